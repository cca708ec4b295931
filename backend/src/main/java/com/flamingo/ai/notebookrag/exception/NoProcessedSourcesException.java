package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Thrown when a notebook has no completed source to answer from. */
public class NoProcessedSourcesException extends ChatException {

  public NoProcessedSourcesException(UUID notebookId) {
    super(
        notebookId,
        "Notebook " + notebookId + " has no processed sources",
        "Add a source and wait for it to finish processing before chatting.");
  }
}
