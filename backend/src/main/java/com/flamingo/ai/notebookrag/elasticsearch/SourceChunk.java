package com.flamingo.ai.notebookrag.elasticsearch;

import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A stored segment of a source's extracted text with its embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceChunk {

  /** {@code <sourceId>_<chunkIndex>}. */
  private String id;

  private UUID notebookId;
  private UUID sourceId;
  private String sourceTitle;

  /** Lower-case source kind, e.g. {@code pdf}. */
  private String sourceKind;

  /** Dense 0-based position within the source. */
  private int chunkIndex;

  private String content;

  private List<Float> embedding;

  /** Builds the deterministic id of a chunk. */
  public static String idOf(UUID sourceId, int chunkIndex) {
    return sourceId + "_" + chunkIndex;
  }
}
