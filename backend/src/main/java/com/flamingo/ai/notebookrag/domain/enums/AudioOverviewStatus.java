package com.flamingo.ai.notebookrag.domain.enums;

/** Status of a notebook's audio overview. */
public enum AudioOverviewStatus {
  /** Script generation and rendering in progress. */
  GENERATING,

  /** Audio asset available until its URL expires. */
  COMPLETED,

  /** Generation failed; a new request starts over. */
  FAILED,

  /** Asset URL has passed its expiry; reported by reads, never stored. */
  EXPIRED
}
