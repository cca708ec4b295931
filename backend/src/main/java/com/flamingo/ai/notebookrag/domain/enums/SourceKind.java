package com.flamingo.ai.notebookrag.domain.enums;

import java.util.Locale;

/** Kind of content a source contributes to a notebook. */
public enum SourceKind {
  /** Uploaded PDF file. */
  PDF,

  /** Inline text, plain text file or word-processor document. */
  TEXT,

  /** Web page fetched from a URL. */
  WEBSITE,

  /** YouTube video referenced by URL. */
  YOUTUBE,

  /** Uploaded audio recording. */
  AUDIO;

  /** Lower-case name stored in chunk metadata. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Infers the kind of an uploaded file from its MIME type.
   *
   * @param mimeType the declared MIME type, may be null
   * @return PDF or AUDIO for those types, TEXT otherwise
   */
  public static SourceKind fromMimeType(String mimeType) {
    if (mimeType == null) {
      return TEXT;
    }
    String normalized = mimeType.toLowerCase(Locale.ROOT);
    if (normalized.equals("application/pdf")) {
      return PDF;
    }
    if (normalized.startsWith("audio/")) {
      return AUDIO;
    }
    return TEXT;
  }
}
