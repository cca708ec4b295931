package com.flamingo.ai.notebookrag.service.ingestion;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceStatus;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.exception.SourceNotFoundException;
import com.flamingo.ai.notebookrag.service.job.LockRetry;
import java.util.EnumSet;
import java.util.UUID;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Single-row source writes used by ingestion. Each write commits in its own transaction and is
 * retried as a whole on SQLite lock contention.
 */
@Component
public class SourceStatusWriter {

  private final SourceRepository sourceRepository;
  private final TransactionTemplate transactionTemplate;

  public SourceStatusWriter(
      SourceRepository sourceRepository, PlatformTransactionManager transactionManager) {
    this.sourceRepository = sourceRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Claims a source for a new ingestion attempt: PENDING or FAILED becomes PROCESSING.
   *
   * @return true if this caller owns the attempt
   */
  public boolean claim(UUID sourceId) {
    Integer claimed =
        LockRetry.withRetry(
            "source " + sourceId,
            () ->
                transactionTemplate.execute(
                    status ->
                        sourceRepository.claimForProcessing(
                            sourceId, EnumSet.of(SourceStatus.PENDING, SourceStatus.FAILED))));
    return claimed != null && claimed == 1;
  }

  /** Stores the extracted text and summary of the running attempt. */
  public void saveExtraction(UUID sourceId, String extractedText, String summary) {
    update(
        sourceId,
        source -> {
          source.setExtractedText(extractedText);
          source.setSummary(summary);
        });
  }

  public void markCompleted(UUID sourceId, int chunkCount) {
    update(sourceId, source -> source.markCompleted(chunkCount));
  }

  public void markFailed(UUID sourceId, String error) {
    update(sourceId, source -> source.markFailed(error));
  }

  private void update(UUID sourceId, Consumer<Source> change) {
    LockRetry.withRetry(
        "source " + sourceId,
        () ->
            transactionTemplate.execute(
                status -> {
                  Source source =
                      sourceRepository
                          .findById(sourceId)
                          .orElseThrow(() -> new SourceNotFoundException(sourceId));
                  change.accept(source);
                  return sourceRepository.save(source);
                }));
  }
}
