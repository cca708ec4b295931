package com.flamingo.ai.notebookrag.llm;

/**
 * Sampling options for one chat call. A null field means "not set at this level".
 *
 * @param temperature sampling temperature
 * @param maxTokens maximum number of generated tokens
 */
public record ChatOptions(Double temperature, Integer maxTokens) {

  private static final ChatOptions NONE = new ChatOptions(null, null);

  public static ChatOptions none() {
    return NONE;
  }

  public static ChatOptions of(double temperature, int maxTokens) {
    return new ChatOptions(temperature, maxTokens);
  }

  /** Returns these options with every field set in {@code override} replaced by its value. */
  public ChatOptions overriddenBy(ChatOptions override) {
    if (override == null) {
      return this;
    }
    return new ChatOptions(
        override.temperature != null ? override.temperature : temperature,
        override.maxTokens != null ? override.maxTokens : maxTokens);
  }
}
