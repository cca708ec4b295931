package com.flamingo.ai.notebookrag.service.chat;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.elasticsearch.ScoredChunk;
import com.flamingo.ai.notebookrag.elasticsearch.SourceChunk;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits a raw answer into paragraphs and attributes them to retrieved chunks.
 *
 * <p>Attribution is positional: segment {@code i} cites chunk {@code i mod n}. It does not check
 * that the chunk actually supports the paragraph.
 */
@Component
public class CitationAssembler {

  static final String UNKNOWN_SOURCE_TITLE = "Unknown source";
  static final String DEFAULT_SOURCE_KIND = "text";
  private static final String ELLIPSIS = "...";

  private final int excerptLength;

  @Autowired
  public CitationAssembler(RagConfig ragConfig) {
    this(ragConfig.getChat().getExcerptLength());
  }

  CitationAssembler(int excerptLength) {
    this.excerptLength = excerptLength;
  }

  public AssembledAnswer assemble(String answer, List<ScoredChunk> chunks) {
    List<String> paragraphs = new ArrayList<>();
    for (String part : answer.split("\n\n")) {
      if (!part.isBlank()) {
        paragraphs.add(part.trim());
      }
    }

    List<AnswerSegment> segments = new ArrayList<>(paragraphs.size());
    List<Citation> citations = new ArrayList<>();
    for (int i = 0; i < paragraphs.size(); i++) {
      if (chunks.isEmpty()) {
        segments.add(new AnswerSegment(paragraphs.get(i), null));
        continue;
      }
      int citationId = i + 1;
      SourceChunk chunk = chunks.get(i % chunks.size()).chunk();
      citations.add(toCitation(citationId, chunk));
      segments.add(new AnswerSegment(paragraphs.get(i), citationId));
    }
    return new AssembledAnswer(List.copyOf(segments), List.copyOf(citations));
  }

  private Citation toCitation(int citationId, SourceChunk chunk) {
    String title = chunk.getSourceTitle();
    String kind = chunk.getSourceKind();
    return new Citation(
        citationId,
        chunk.getSourceId(),
        title == null || title.isBlank() ? UNKNOWN_SOURCE_TITLE : title,
        kind == null || kind.isBlank() ? DEFAULT_SOURCE_KIND : kind,
        chunk.getChunkIndex(),
        excerpt(chunk.getContent()));
  }

  String excerpt(String content) {
    if (content == null) {
      return "";
    }
    if (content.length() <= excerptLength) {
      return content;
    }
    return content.substring(0, excerptLength - ELLIPSIS.length()) + ELLIPSIS;
  }
}
