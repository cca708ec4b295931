package com.flamingo.ai.notebookrag.domain.enums;

/** Author of a persisted chat message. */
public enum MessageRole {
  /** Message written by the notebook owner. */
  HUMAN,

  /** Answer produced by the language model. */
  AI
}
