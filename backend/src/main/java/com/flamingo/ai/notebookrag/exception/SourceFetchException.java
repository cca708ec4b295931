package com.flamingo.ai.notebookrag.exception;

import java.util.UUID;

/** Thrown when a remote source (web page) cannot be fetched. */
public class SourceFetchException extends ExtractionException {

  private final String url;

  public SourceFetchException(UUID sourceId, String url, Throwable cause) {
    super(
        sourceId,
        "Failed to fetch " + url + ": " + cause.getMessage(),
        "The page could not be downloaded.",
        cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
