package com.flamingo.ai.notebookrag.domain.enums;

import com.flamingo.ai.notebookrag.exception.UnsupportedProviderException;
import java.util.Locale;

/** LLM backends the pipeline can dispatch to. */
public enum ProviderType {
  OPENAI("openai"),
  ANTHROPIC("anthropic"),
  GEMINI("gemini"),
  OLLAMA("ollama");

  private final String value;

  ProviderType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolves a stored provider name.
   *
   * @param value provider name as stored on a configuration row
   * @return the matching provider type
   * @throws UnsupportedProviderException if the name is unknown
   */
  public static ProviderType fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (ProviderType type : values()) {
        if (type.value.equals(normalized)) {
          return type;
        }
      }
    }
    throw new UnsupportedProviderException(value);
  }
}
