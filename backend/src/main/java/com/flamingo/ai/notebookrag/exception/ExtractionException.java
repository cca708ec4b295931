package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Base exception for failures turning a source into plain text. */
public abstract class ExtractionException extends RuntimeException {

  private final UUID sourceId;
  private final String userMessage;

  protected ExtractionException(UUID sourceId, String message, String userMessage) {
    super(message);
    this.sourceId = sourceId;
    this.userMessage = userMessage;
  }

  protected ExtractionException(
      UUID sourceId, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.sourceId = sourceId;
    this.userMessage = userMessage;
  }

  public UUID getSourceId() {
    return sourceId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
