package com.flamingo.ai.notebookrag.service.chunking;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits extracted text into retrieval-sized chunks.
 *
 * <p>Text no longer than {@code maxChunkSize} is a single chunk. Longer text is split on blank
 * lines and paragraphs are packed into chunks joined by {@code "\n\n"}; a chunk is flushed when
 * the next paragraph would push it past {@code maxChunkSize}. A paragraph that alone exceeds the
 * limit is cut into windows of {@code maxChunkSize} characters, each starting {@code maxChunkSize
 * - overlap} characters after the previous one.
 *
 * <p>The output depends only on the text and the two sizes.
 */
@Component
public class TextChunker {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");

  private final int maxChunkSize;
  private final int overlap;

  @Autowired
  public TextChunker(RagConfig ragConfig) {
    this(ragConfig.getChunking().getMaxChunkSize(), ragConfig.getChunking().getOverlap());
  }

  @VisibleForTesting
  public TextChunker(int maxChunkSize, int overlap) {
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("maxChunkSize must be positive, got " + maxChunkSize);
    }
    if (overlap < 0 || overlap >= maxChunkSize) {
      throw new IllegalArgumentException(
          "overlap must be in [0, maxChunkSize), got " + overlap + " for size " + maxChunkSize);
    }
    this.maxChunkSize = maxChunkSize;
    this.overlap = overlap;
  }

  /**
   * Splits text into ordered chunks.
   *
   * @param text extracted text, null is treated as empty
   * @return at least one chunk
   */
  public List<String> split(String text) {
    String input = text == null ? "" : text;
    if (input.length() <= maxChunkSize) {
      return List.of(input);
    }

    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String paragraph : PARAGRAPH_BREAK.split(input)) {
      if (paragraph.length() > maxChunkSize) {
        if (current.length() > 0) {
          chunks.add(current.toString());
          current.setLength(0);
        }
        slice(paragraph, chunks);
      } else if (current.length() + paragraph.length() > maxChunkSize) {
        chunks.add(current.toString());
        current.setLength(0);
        current.append(paragraph);
      } else {
        if (current.length() > 0) {
          current.append("\n\n");
        }
        current.append(paragraph);
      }
    }
    if (current.length() > 0) {
      chunks.add(current.toString());
    }
    return List.copyOf(chunks);
  }

  private void slice(String paragraph, List<String> chunks) {
    int step = maxChunkSize - overlap;
    for (int start = 0; start < paragraph.length(); start += step) {
      chunks.add(paragraph.substring(start, Math.min(start + maxChunkSize, paragraph.length())));
    }
  }
}
