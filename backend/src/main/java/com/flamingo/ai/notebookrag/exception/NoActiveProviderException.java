package com.flamingo.ai.notebookrag.exception;

/** Thrown when no active provider configuration exists. */
public class NoActiveProviderException extends ConfigurationException {

  public NoActiveProviderException() {
    super(
        "No active LLM provider configured",
        "No AI provider is configured. Ask an administrator to activate one.");
  }
}
