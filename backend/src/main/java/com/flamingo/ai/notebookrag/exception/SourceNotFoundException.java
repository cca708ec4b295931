package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Exception thrown when a source is not found. */
public class SourceNotFoundException extends RuntimeException {

  private final UUID id;

  public SourceNotFoundException(UUID id) {
    super("Source not found: " + id);
    this.id = id;
  }

  public UUID getId() {
    return id;
  }
}
