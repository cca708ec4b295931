package com.flamingo.ai.notebookrag.service.ingestion;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.elasticsearch.ChunkMetadata;
import com.flamingo.ai.notebookrag.elasticsearch.VectorStore;
import com.flamingo.ai.notebookrag.exception.ConfigurationException;
import com.flamingo.ai.notebookrag.exception.ExtractionException;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.SourceNotFoundException;
import com.flamingo.ai.notebookrag.service.chunking.TextChunker;
import com.flamingo.ai.notebookrag.service.extraction.TextExtractionRouter;
import com.flamingo.ai.notebookrag.service.job.BackgroundJobRunner;
import com.flamingo.ai.notebookrag.service.summary.SourceSummaryService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a stored source into searchable chunks: extract, summarize, chunk, embed and index.
 *
 * <p>Status transitions are PENDING or FAILED to PROCESSING (claimed atomically), then COMPLETED
 * once every chunk is indexed, or FAILED with any partially written chunks removed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

  static final String JOB_TYPE = "ingestion";

  private final SourceRepository sourceRepository;
  private final SourceStatusWriter statusWriter;
  private final TextExtractionRouter extractionRouter;
  private final SourceSummaryService summaryService;
  private final TextChunker textChunker;
  private final VectorStore vectorStore;
  private final BackgroundJobRunner jobRunner;
  private final MeterRegistry meterRegistry;

  /**
   * Claims the source and schedules ingestion in the background.
   *
   * @return false if another attempt is already processing the source or it is completed
   */
  public boolean submit(UUID sourceId) {
    if (!statusWriter.claim(sourceId)) {
      log.info("Source {} is not pending or failed, ingestion not started", sourceId);
      return false;
    }
    try {
      jobRunner.submit(JOB_TYPE, sourceId, () -> process(sourceId));
    } catch (RejectedExecutionException e) {
      log.error("Ingestion queue full, failing source {}", sourceId);
      statusWriter.markFailed(sourceId, "Ingestion queue is full, please retry later");
      meterRegistry.counter("source.ingestion.failure").increment();
      return false;
    }
    return true;
  }

  /**
   * Claims the source and ingests it on the calling thread.
   *
   * @return false if the source could not be claimed
   */
  public boolean ingestNow(UUID sourceId) {
    if (!statusWriter.claim(sourceId)) {
      return false;
    }
    process(sourceId);
    return true;
  }

  /** Runs one claimed ingestion attempt. Never throws; failures end in FAILED status. */
  void process(UUID sourceId) {
    Source source;
    try {
      source =
          sourceRepository
              .findWithNotebookById(sourceId)
              .orElseThrow(() -> new SourceNotFoundException(sourceId));
    } catch (SourceNotFoundException e) {
      log.warn("Source {} disappeared before ingestion started", sourceId);
      return;
    }

    long start = System.currentTimeMillis();
    try {
      String text = extractionRouter.extract(source);
      String summary = summaryService.summarize(source.getTitle(), text);
      statusWriter.saveExtraction(sourceId, text, summary);

      List<String> chunks = textChunker.split(text);
      UUID notebookId = source.getNotebook().getId();
      String kind = source.getKind().value();
      for (int i = 0; i < chunks.size(); i++) {
        vectorStore.insert(
            chunks.get(i), new ChunkMetadata(notebookId, sourceId, source.getTitle(), kind, i));
      }
      vectorStore.refresh();

      statusWriter.markCompleted(sourceId, chunks.size());
      long elapsed = System.currentTimeMillis() - start;
      meterRegistry.counter("source.ingestion.success").increment();
      meterRegistry.timer("source.ingestion.duration").record(Duration.ofMillis(elapsed));
      log.info(
          "Ingested source {} ('{}'): {} chunks in {}ms",
          sourceId,
          source.getTitle(),
          chunks.size(),
          elapsed);
    } catch (RuntimeException e) {
      log.error("Ingestion failed for source {}: {}", sourceId, e.getMessage(), e);
      removePartialChunks(sourceId);
      statusWriter.markFailed(sourceId, failureMessage(e));
      meterRegistry.counter("source.ingestion.failure").increment();
    }
  }

  private void removePartialChunks(UUID sourceId) {
    try {
      vectorStore.deleteBySource(sourceId);
    } catch (RuntimeException cleanupError) {
      log.warn(
          "Could not remove partial chunks of source {}: {}",
          sourceId,
          cleanupError.getMessage());
    }
  }

  static String failureMessage(RuntimeException e) {
    if (e instanceof ExtractionException extraction) {
      return extraction.getUserMessage();
    }
    if (e instanceof ProviderException provider) {
      return provider.getUserMessage();
    }
    if (e instanceof ConfigurationException configuration) {
      return configuration.getUserMessage();
    }
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
