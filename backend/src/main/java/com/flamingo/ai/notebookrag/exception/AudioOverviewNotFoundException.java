package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Exception thrown when an operation needs an audio overview the notebook does not have. */
public class AudioOverviewNotFoundException extends RuntimeException {

  private final UUID notebookId;

  public AudioOverviewNotFoundException(UUID notebookId) {
    super("No audio overview for notebook: " + notebookId);
    this.notebookId = notebookId;
  }

  public UUID getNotebookId() {
    return notebookId;
  }
}
