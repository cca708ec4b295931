package com.flamingo.ai.notebookrag.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TextChunker Tests")
class TextChunkerTest {

  @Nested
  @DisplayName("Short text")
  class ShortText {

    @Test
    @DisplayName("Should return text as the only chunk when it fits")
    void shouldReturnSingleChunk_whenTextFits() {
      TextChunker chunker = new TextChunker(1000, 200);

      assertThat(chunker.split("Hello world.")).containsExactly("Hello world.");
    }

    @Test
    @DisplayName("Should return one empty chunk for empty or null text")
    void shouldReturnOneEmptyChunk_whenTextEmpty() {
      TextChunker chunker = new TextChunker(1000, 200);

      assertThat(chunker.split("")).containsExactly("");
      assertThat(chunker.split(null)).containsExactly("");
    }

    @Test
    @DisplayName("Should keep paragraph breaks of text exactly at the limit")
    void shouldKeepText_whenExactlyAtLimit() {
      TextChunker chunker = new TextChunker(10, 3);

      assertThat(chunker.split("abcd\n\nefgh")).containsExactly("abcd\n\nefgh");
    }
  }

  @Nested
  @DisplayName("Paragraph packing")
  class ParagraphPacking {

    @Test
    @DisplayName("Should pack paragraphs until the next one would exceed the limit")
    void shouldPackParagraphs() {
      TextChunker chunker = new TextChunker(10, 3);

      assertThat(chunker.split("aaaa\n\nbbbb\n\ncccc")).containsExactly("aaaa\n\nbbbb", "cccc");
    }

    @Test
    @DisplayName("Should treat whitespace-only lines as paragraph breaks")
    void shouldSplitOnBlankLinesWithWhitespace() {
      TextChunker chunker = new TextChunker(10, 3);

      assertThat(chunker.split("aaaaaa\n   \nbbbbbb")).containsExactly("aaaaaa", "bbbbbb");
    }

    @Test
    @DisplayName("Should produce two chunks for five 300 character paragraphs")
    void shouldPackRealisticParagraphs() {
      TextChunker chunker = new TextChunker(1000, 200);
      String paragraph = "x".repeat(300);
      String text = String.join("\n\n", paragraph, paragraph, paragraph, paragraph, paragraph);

      List<String> chunks = chunker.split(text);

      assertThat(chunks).hasSize(2);
      assertThat(chunks.get(0)).isEqualTo(String.join("\n\n", paragraph, paragraph, paragraph));
      assertThat(chunks.get(1)).isEqualTo(String.join("\n\n", paragraph, paragraph));
    }
  }

  @Nested
  @DisplayName("Oversized paragraphs")
  class OversizedParagraphs {

    @Test
    @DisplayName("Should slice a long paragraph into overlapping windows")
    void shouldSliceWithOverlap() {
      TextChunker chunker = new TextChunker(10, 3);

      assertThat(chunker.split("0123456789ABCDEF"))
          .containsExactly("0123456789", "789ABCDEF", "EF");
    }

    @Test
    @DisplayName("Should flush the buffer before slicing and keep source order")
    void shouldFlushBufferBeforeSlicing() {
      TextChunker chunker = new TextChunker(10, 3);

      assertThat(chunker.split("ab\n\n0123456789ABCDEF\n\ncd"))
          .containsExactly("ab", "0123456789", "789ABCDEF", "EF", "cd");
    }

    @Test
    @DisplayName("Should reconstruct a sliced paragraph after removing overlap")
    void shouldReconstructSlicedParagraph() {
      int overlap = 10;
      TextChunker chunker = new TextChunker(50, overlap);
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < 40; i++) {
        sb.append("word").append(i).append(' ');
      }
      String text = sb.toString();

      List<String> chunks = chunker.split(text);

      StringBuilder rebuilt = new StringBuilder(chunks.get(0));
      for (int i = 1; i < chunks.size(); i++) {
        String chunk = chunks.get(i);
        rebuilt.append(chunk.substring(Math.min(overlap, chunk.length())));
      }
      assertThat(rebuilt.toString()).isEqualTo(text);
      assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.length()).isLessThanOrEqualTo(50));
    }
  }

  @Test
  @DisplayName("Should be deterministic")
  void shouldBeDeterministic() {
    TextChunker chunker = new TextChunker(20, 5);
    String text = "first paragraph here\n\nsecond one\n\n" + "z".repeat(70);

    assertThat(chunker.split(text)).isEqualTo(chunker.split(text));
  }

  @Test
  @DisplayName("Should reject overlap not smaller than chunk size")
  void shouldRejectInvalidConfiguration() {
    assertThatThrownBy(() -> new TextChunker(10, 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TextChunker(10, -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new TextChunker(0, 0)).isInstanceOf(IllegalArgumentException.class);
  }
}
