package com.flamingo.ai.notebookrag.service.extraction;

import com.flamingo.ai.notebookrag.domain.entity.Source;
import com.flamingo.ai.notebookrag.domain.enums.SourceKind;
import java.nio.file.Path;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Stand-in transcripts for YouTube videos and audio uploads.
 *
 * <p>No transcription backend is wired in yet; the text says so explicitly so that answers built
 * on it are recognisable.
 */
@Component
@Order(40)
public class TranscriptPlaceholderExtractor implements SourceTextExtractor {

  static final String PLACEHOLDER_NOTICE =
      "This is a placeholder transcript. No transcription service is configured, so the spoken"
          + " content of this source is not available.";

  @Override
  public boolean supports(Source source) {
    return source.getKind() == SourceKind.YOUTUBE || source.getKind() == SourceKind.AUDIO;
  }

  @Override
  public String extract(Source source) {
    if (source.getKind() == SourceKind.YOUTUBE) {
      return "YouTube video transcript: " + source.getUrl() + "\n\n" + PLACEHOLDER_NOTICE;
    }
    String name =
        source.getFilePath() != null
            ? Path.of(source.getFilePath()).getFileName().toString()
            : source.getTitle();
    return "Audio transcript: " + name + "\n\n" + PLACEHOLDER_NOTICE;
  }
}
