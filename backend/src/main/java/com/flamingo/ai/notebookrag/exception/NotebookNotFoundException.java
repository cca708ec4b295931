package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Exception thrown when a notebook is not found. */
public class NotebookNotFoundException extends RuntimeException {

  private final UUID id;

  public NotebookNotFoundException(UUID id) {
    super("Notebook not found: " + id);
    this.id = id;
  }

  public UUID getId() {
    return id;
  }
}
