package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Base exception for chat turns that cannot be answered. */
public class ChatException extends RuntimeException {

  private final UUID notebookId;
  private final String userMessage;

  public ChatException(UUID notebookId, String message, String userMessage) {
    super(message);
    this.notebookId = notebookId;
    this.userMessage = userMessage;
  }

  public UUID getNotebookId() {
    return notebookId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
