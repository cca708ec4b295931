package com.flamingo.ai.notebookrag.exception;

/** Thrown when neither the active provider nor an OpenAI configuration can embed text. */
public class NoEmbeddingProviderAvailableException extends ConfigurationException {

  public NoEmbeddingProviderAvailableException(String activeProvider) {
    super(
        "Provider '"
            + activeProvider
            + "' has no embedding support and no active OpenAI configuration exists",
        "No embedding-capable AI provider is configured.");
  }
}
