package com.flamingo.ai.notebookrag.exception;

/** Base exception for missing or inconsistent provider configuration. */
public class ConfigurationException extends RuntimeException {

  private final String userMessage;

  public ConfigurationException(String message, String userMessage) {
    super(message);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
