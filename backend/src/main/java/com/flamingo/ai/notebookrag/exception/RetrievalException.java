package com.flamingo.ai.notebookrag.exception;

/** Exception thrown when similarity retrieval fails. */
public class RetrievalException extends RuntimeException {

  private final String userMessage;

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
