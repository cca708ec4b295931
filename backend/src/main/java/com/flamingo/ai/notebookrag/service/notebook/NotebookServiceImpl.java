package com.flamingo.ai.notebookrag.service.notebook;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.elasticsearch.VectorStore;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.service.audio.AudioRenderer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the NotebookService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotebookServiceImpl implements NotebookService {

  private final NotebookRepository notebookRepository;
  private final VectorStore vectorStore;
  private final AudioRenderer audioRenderer;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "notebook.create", description = "Time to create a notebook")
  public Notebook create(String ownerId, String title) {
    if (ownerId == null || ownerId.isBlank()) {
      throw new IllegalArgumentException("ownerId must not be blank");
    }
    Notebook saved =
        notebookRepository.save(
            Notebook.builder()
                .ownerId(ownerId)
                .title(title == null || title.isBlank() ? "Untitled notebook" : title.trim())
                .build());
    meterRegistry.counter("notebook.created").increment();
    log.info("Created notebook {} for owner {}", saved.getId(), ownerId);
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Notebook get(UUID notebookId) {
    return notebookRepository
        .findById(notebookId)
        .orElseThrow(() -> new NotebookNotFoundException(notebookId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Notebook> listByOwner(String ownerId) {
    return notebookRepository.findByOwnerIdOrderByUpdatedAtDesc(ownerId);
  }

  @Override
  @Transactional
  @Timed(value = "notebook.delete", description = "Time to delete a notebook")
  public void delete(UUID notebookId) {
    Notebook notebook = get(notebookId);

    // Chunks first: a failed purge leaves the notebook in place and the call can be repeated.
    vectorStore.deleteByNotebook(notebookId);

    String audioUrl = notebook.getAudioOverviewUrl();
    notebookRepository.delete(notebook);
    if (audioUrl != null) {
      try {
        audioRenderer.delete(audioUrl);
      } catch (RuntimeException e) {
        log.warn("Could not delete audio asset {}: {}", audioUrl, e.getMessage());
      }
    }
    meterRegistry.counter("notebook.deleted").increment();
    log.info("Deleted notebook {}", notebookId);
  }
}
