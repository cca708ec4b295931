package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Exception thrown when a provider configuration is not found. */
public class ProviderConfigNotFoundException extends RuntimeException {

  private final UUID id;

  public ProviderConfigNotFoundException(UUID id) {
    super("ProviderConfig not found: " + id);
    this.id = id;
  }

  public UUID getId() {
    return id;
  }
}
