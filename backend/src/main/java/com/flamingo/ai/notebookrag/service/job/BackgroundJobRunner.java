package com.flamingo.ai.notebookrag.service.job;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs long background jobs on the bounded job executor.
 *
 * <p>Each job gets a {@link CompletableFuture}; an exception escaping a job completes the future
 * exceptionally and is logged and counted here. Job state visible to callers lives in persisted
 * status fields, the futures are for tests and shutdown.
 */
@Component
@Slf4j
public class BackgroundJobRunner {

  private final Executor executor;
  private final MeterRegistry meterRegistry;
  private final Map<String, CompletableFuture<Void>> running = new ConcurrentHashMap<>();

  public BackgroundJobRunner(
      @Qualifier("backgroundJobExecutor") Executor executor, MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Schedules a job.
   *
   * @param jobType short job name used in logs and metrics, e.g. {@code ingestion}
   * @param subjectId id of the entity the job works on
   * @param job the work
   * @return a future completing when the job ends
   * @throws java.util.concurrent.RejectedExecutionException if the job queue is full
   */
  public CompletableFuture<Void> submit(String jobType, UUID subjectId, Runnable job) {
    String key = jobType + ":" + subjectId;
    CompletableFuture<Void> future =
        CompletableFuture.runAsync(
            () -> {
              log.debug("Starting {} job for {}", jobType, subjectId);
              try {
                job.run();
                meterRegistry.counter("background.job.success", "type", jobType).increment();
              } catch (RuntimeException e) {
                meterRegistry.counter("background.job.failure", "type", jobType).increment();
                log.error("{} job for {} failed: {}", jobType, subjectId, e.getMessage(), e);
                throw e;
              }
            },
            executor);
    running.put(key, future);
    future.whenComplete((ignored, error) -> running.remove(key, future));
    return future;
  }

  /** Whether a job of this type is still running for the subject in this process. */
  public boolean isRunning(String jobType, UUID subjectId) {
    CompletableFuture<Void> future = running.get(jobType + ":" + subjectId);
    return future != null && !future.isDone();
  }
}
