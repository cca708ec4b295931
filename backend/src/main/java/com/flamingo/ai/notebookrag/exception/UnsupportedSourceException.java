package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Thrown when no extractor handles a source's kind or MIME type. */
public class UnsupportedSourceException extends ExtractionException {

  public UnsupportedSourceException(UUID sourceId, String message) {
    super(sourceId, message, "This file type is not supported.");
  }
}
