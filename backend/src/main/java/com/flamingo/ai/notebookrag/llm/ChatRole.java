package com.flamingo.ai.notebookrag.llm;

/** Provider-neutral role of a message sent to a chat model. */
public enum ChatRole {
  SYSTEM,
  USER,
  ASSISTANT
}
