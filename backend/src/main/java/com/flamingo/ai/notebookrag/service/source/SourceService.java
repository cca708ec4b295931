package com.flamingo.ai.notebookrag.service.source;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import java.util.List;
import java.util.UUID;

/**
 * Service for adding and removing notebook sources. Every added source starts PENDING and is
 * handed to ingestion once its row is committed.
 */
public interface SourceService {

  /**
   * Adds an uploaded file already written to the file store.
   *
   * @param kind PDF, TEXT or AUDIO; inferred from {@code mimeType} when null
   * @param filePath path relative to the file store root
   */
  Source addFile(
      UUID notebookId,
      SourceKind kind,
      String title,
      String filePath,
      String mimeType,
      long fileSize);

  /** Adds pasted text. */
  Source addText(UUID notebookId, String title, String text);

  /**
   * Adds a web page or video by URL.
   *
   * @param kind WEBSITE or YOUTUBE
   */
  Source addUrl(UUID notebookId, SourceKind kind, String title, String url);

  /**
   * Starts a new ingestion attempt for a failed or still pending source.
   *
   * @return false if the source is processing or already completed
   */
  boolean resubmit(UUID sourceId);

  Source get(UUID sourceId);

  /** Lists a notebook's sources, newest first. */
  List<Source> listByNotebook(UUID notebookId);

  /** Deletes a source and its chunks. */
  void delete(UUID sourceId);
}
