package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Thrown when source bytes are corrupt or cannot be parsed. */
public class UnreadableSourceException extends ExtractionException {

  public UnreadableSourceException(UUID sourceId, String message) {
    super(sourceId, message, "The file could not be read.");
  }

  public UnreadableSourceException(UUID sourceId, String message, Throwable cause) {
    super(sourceId, message, "The file could not be read.", cause);
  }
}
