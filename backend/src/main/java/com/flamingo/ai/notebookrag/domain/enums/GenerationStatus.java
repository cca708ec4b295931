package com.flamingo.ai.notebookrag.domain.enums;

/** Status of the notebook title/summary generation job. */
public enum GenerationStatus {
  PENDING,
  GENERATING,
  COMPLETED,
  FAILED
}
