package com.flamingo.ai.notebookrag.llm;

import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.ProviderException.Reason;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import java.io.IOException;
import java.io.UncheckedIOException;

/** Translates backend client failures into {@link ProviderException} reasons. */
public final class ProviderFailures {

  private ProviderFailures() {}

  /**
   * Wraps a failure thrown by a LangChain4j model.
   *
   * @param provider provider name used in the call
   * @param e the failure
   * @return a provider exception with a reason callers can branch on
   */
  public static ProviderException translate(String provider, RuntimeException e) {
    if (e instanceof ProviderException pe) {
      return pe;
    }
    return new ProviderException(
        reasonOf(e), provider, provider + " call failed: " + e.getMessage(), e);
  }

  static Reason reasonOf(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof AuthenticationException) {
        return Reason.AUTHENTICATION;
      }
      if (t instanceof RateLimitException) {
        return Reason.RATE_LIMITED;
      }
      if (t instanceof TimeoutException
          || t instanceof IOException
          || t instanceof UncheckedIOException) {
        return Reason.NETWORK;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return Reason.PROVIDER_FAILURE;
  }
}
