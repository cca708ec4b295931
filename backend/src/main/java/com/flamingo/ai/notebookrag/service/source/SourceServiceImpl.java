package com.flamingo.ai.notebookrag.service.source;

import com.flamingo.ai.notebookrag.domain.entity.Notebook;
import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import com.flamingo.ai.notebookrag.domain.repository.NotebookRepository;
import com.flamingo.ai.notebookrag.domain.repository.SourceRepository;
import com.flamingo.ai.notebookrag.elasticsearch.VectorStore;
import com.flamingo.ai.notebookrag.exception.NotebookNotFoundException;
import com.flamingo.ai.notebookrag.exception.SourceNotFoundException;
import com.flamingo.ai.notebookrag.service.ingestion.IngestionService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Implementation of the SourceService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceServiceImpl implements SourceService {

  private final SourceRepository sourceRepository;
  private final NotebookRepository notebookRepository;
  private final IngestionService ingestionService;
  private final VectorStore vectorStore;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "source.add", description = "Time to add a source")
  public Source addFile(
      UUID notebookId,
      SourceKind kind,
      String title,
      String filePath,
      String mimeType,
      long fileSize) {
    if (filePath == null || filePath.isBlank()) {
      throw new IllegalArgumentException("filePath must not be blank");
    }
    SourceKind effectiveKind = kind != null ? kind : SourceKind.fromMimeType(mimeType);
    if (effectiveKind == SourceKind.WEBSITE || effectiveKind == SourceKind.YOUTUBE) {
      throw new IllegalArgumentException("File sources cannot be of kind " + effectiveKind);
    }
    Path fileName = Path.of(filePath).getFileName();
    return persist(
        Source.builder()
            .notebook(notebook(notebookId))
            .kind(effectiveKind)
            .title(titleOr(title, fileName != null ? fileName.toString() : filePath))
            .filePath(filePath)
            .mimeType(mimeType)
            .fileSize(fileSize)
            .build());
  }

  @Override
  @Transactional
  @Timed(value = "source.add", description = "Time to add a source")
  public Source addText(UUID notebookId, String title, String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("text must not be blank");
    }
    return persist(
        Source.builder()
            .notebook(notebook(notebookId))
            .kind(SourceKind.TEXT)
            .title(titleOr(title, "Pasted text"))
            .inlineText(text)
            .mimeType("text/plain")
            .fileSize((long) text.length())
            .build());
  }

  @Override
  @Transactional
  @Timed(value = "source.add", description = "Time to add a source")
  public Source addUrl(UUID notebookId, SourceKind kind, String title, String url) {
    if (kind != SourceKind.WEBSITE && kind != SourceKind.YOUTUBE) {
      throw new IllegalArgumentException("URL sources must be WEBSITE or YOUTUBE, got " + kind);
    }
    if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
      throw new IllegalArgumentException("url must be an http or https URL");
    }
    return persist(
        Source.builder()
            .notebook(notebook(notebookId))
            .kind(kind)
            .title(titleOr(title, url))
            .url(url)
            .build());
  }

  @Override
  public boolean resubmit(UUID sourceId) {
    if (!sourceRepository.existsById(sourceId)) {
      throw new SourceNotFoundException(sourceId);
    }
    log.info("Resubmitting source {} for ingestion", sourceId);
    return ingestionService.submit(sourceId);
  }

  @Override
  @Transactional(readOnly = true)
  public Source get(UUID sourceId) {
    return sourceRepository
        .findById(sourceId)
        .orElseThrow(() -> new SourceNotFoundException(sourceId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Source> listByNotebook(UUID notebookId) {
    if (!notebookRepository.existsById(notebookId)) {
      throw new NotebookNotFoundException(notebookId);
    }
    return sourceRepository.findByNotebookIdOrderByCreatedAtDesc(notebookId);
  }

  @Override
  @Transactional
  @Timed(value = "source.delete", description = "Time to delete a source")
  public void delete(UUID sourceId) {
    Source source = get(sourceId);
    vectorStore.deleteBySource(sourceId);
    sourceRepository.delete(source);
    meterRegistry.counter("source.deleted").increment();
    log.info("Deleted source {}", sourceId);
  }

  private Source persist(Source source) {
    Source saved = sourceRepository.save(source);
    meterRegistry.counter("source.added", "kind", saved.getKind().value()).increment();

    // Ingestion runs on another thread and must see the committed row.
    final UUID sourceId = saved.getId();
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, submitting source {} for ingestion", sourceId);
              ingestionService.submit(sourceId);
            }
          });
    } else {
      log.debug("No active transaction, submitting source {} directly", sourceId);
      ingestionService.submit(sourceId);
    }

    log.info("Added {} source {} to notebook", saved.getKind().value(), sourceId);
    return saved;
  }

  private Notebook notebook(UUID notebookId) {
    return notebookRepository
        .findById(notebookId)
        .orElseThrow(() -> new NotebookNotFoundException(notebookId));
  }

  private static String titleOr(String title, String fallback) {
    return title == null || title.isBlank() ? fallback : title.trim();
  }
}
