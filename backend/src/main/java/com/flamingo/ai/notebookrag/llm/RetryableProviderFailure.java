package com.flamingo.ai.notebookrag.llm;

import com.flamingo.ai.notebookrag.exception.ProviderException;
import java.util.function.Predicate;

/** Resilience4j retry predicate: only rate limits and network failures are retried. */
public class RetryableProviderFailure implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    return throwable instanceof ProviderException pe && pe.isTransient();
  }
}
