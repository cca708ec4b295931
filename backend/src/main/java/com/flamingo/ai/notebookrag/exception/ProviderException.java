package com.flamingo.ai.notebookrag.exception;

/** Exception thrown when an LLM or embedding backend call fails. */
public class ProviderException extends RuntimeException {

  /** Why the backend call failed. */
  public enum Reason {
    AUTHENTICATION,
    RATE_LIMITED,
    NETWORK,
    INVALID_RESPONSE,
    UNSUPPORTED_PROVIDER,
    PROVIDER_FAILURE
  }

  private final Reason reason;
  private final String provider;
  private final String userMessage;

  public ProviderException(Reason reason, String provider, String message) {
    super(message);
    this.reason = reason;
    this.provider = provider;
    this.userMessage = userMessageFor(reason);
  }

  public ProviderException(Reason reason, String provider, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.provider = provider;
    this.userMessage = userMessageFor(reason);
  }

  private static String userMessageFor(Reason reason) {
    return switch (reason) {
      case AUTHENTICATION -> "The AI provider rejected the configured credentials.";
      case RATE_LIMITED -> "Service is temporarily busy. Please try again in a moment.";
      case UNSUPPORTED_PROVIDER -> "The configured AI provider is not supported.";
      case INVALID_RESPONSE -> "The AI provider returned an empty or invalid response.";
      default -> "AI service is temporarily unavailable. Please try again later.";
    };
  }

  /** Rate limits and network failures may succeed when retried. */
  public boolean isTransient() {
    return reason == Reason.RATE_LIMITED || reason == Reason.NETWORK;
  }

  public Reason getReason() {
    return reason;
  }

  public String getProvider() {
    return provider;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
