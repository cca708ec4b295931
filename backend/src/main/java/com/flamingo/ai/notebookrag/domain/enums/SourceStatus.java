package com.flamingo.ai.notebookrag.domain.enums;

/** Ingestion status of a source. */
public enum SourceStatus {
  /** Created but no ingestion attempt has claimed it yet. */
  PENDING,

  /** An ingestion attempt is running (extraction, summary, chunking, embedding). */
  PROCESSING,

  /** Text extracted and all chunks stored; the source is usable for chat. */
  COMPLETED,

  /** The last attempt failed; a re-submission starts a new attempt. */
  FAILED
}
