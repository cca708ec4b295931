package com.flamingo.ai.notebookrag.service.summary;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import java.util.List;

/** Builds the short per-source text used as input for notebook-level generation. */
public final class SourceDigest {

  private SourceDigest() {}

  /** The source summary, or the beginning of its extracted text if there is no summary. */
  public static String of(Source source, int previewChars) {
    if (source.getSummary() != null && !source.getSummary().isBlank()) {
      return source.getSummary();
    }
    String text = source.getExtractedText();
    if (text == null) {
      return "";
    }
    return text.length() > previewChars ? text.substring(0, previewChars) : text;
  }

  /** Digests of several sources, each headed by its title, joined by blank lines. */
  public static String join(List<Source> sources, int previewChars) {
    StringBuilder sb = new StringBuilder();
    for (Source source : sources) {
      if (sb.length() > 0) {
        sb.append("\n\n");
      }
      sb.append("Source: ").append(source.getTitle()).append("\n").append(of(source, previewChars));
    }
    return sb.toString();
  }
}
