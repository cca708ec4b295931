package com.flamingo.ai.notebookrag.service.job;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;

/** Retries single-row writes that lose a SQLite write lock to a concurrent writer. */
@Slf4j
public final class LockRetry {

  public static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private LockRetry() {}

  /**
   * Runs the write, retrying with linear backoff while the database reports lock contention.
   *
   * @param subject what is being written, for logs
   * @throws CannotAcquireLockException after {@link #MAX_RETRIES} failed attempts
   */
  public static <T> T withRetry(String subject, Supplier<T> write) {
    for (int attempt = 1; ; attempt++) {
      try {
        return write.get();
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update {} after {} retries", subject, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on {}, retry {}/{}", subject, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
