package com.flamingo.ai.notebookrag.service.notebook;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.service.job.LockRetry;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Notebook writes made by background jobs, each committed on its own and retried on SQLite lock
 * contention.
 */
@Component
public class NotebookStateWriter {

  private final NotebookRepository notebookRepository;
  private final TransactionTemplate transactionTemplate;

  public NotebookStateWriter(
      NotebookRepository notebookRepository, PlatformTransactionManager transactionManager) {
    this.notebookRepository = notebookRepository;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /** Claims the content generation job. False if it is already running. */
  public boolean claimContentGeneration(UUID notebookId) {
    return claim(notebookId, () -> notebookRepository.claimContentGeneration(notebookId));
  }

  /** Claims the audio overview job. False if it is already running. */
  public boolean claimAudioGeneration(UUID notebookId) {
    return claim(notebookId, () -> notebookRepository.claimAudioGeneration(notebookId));
  }

  /**
   * Applies a change to the notebook and commits it.
   *
   * @throws NotebookNotFoundException if the notebook no longer exists
   */
  public Notebook update(UUID notebookId, Consumer<Notebook> change) {
    return LockRetry.withRetry(
        "notebook " + notebookId,
        () ->
            transactionTemplate.execute(
                status -> {
                  Notebook notebook =
                      notebookRepository
                          .findById(notebookId)
                          .orElseThrow(() -> new NotebookNotFoundException(notebookId));
                  change.accept(notebook);
                  return notebookRepository.save(notebook);
                }));
  }

  private boolean claim(UUID notebookId, IntSupplier query) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    Integer claimed =
        LockRetry.withRetry(
            "notebook " + notebookId,
            () -> transactionTemplate.execute(status -> query.getAsInt()));
    return claimed != null && claimed == 1;
  }
}
