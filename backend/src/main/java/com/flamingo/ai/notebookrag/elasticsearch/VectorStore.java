package com.flamingo.ai.notebookrag.elasticsearch;

import java.util.List;
import java.util.UUID;

/** Chunk storage with notebook-scoped similarity search. */
public interface VectorStore {

  /**
   * Embeds and stores one chunk. If embedding fails nothing is written.
   *
   * @return the chunk id
   */
  String insert(String chunkText, ChunkMetadata metadata);

  /**
   * Returns the chunks of one notebook most similar to the query, best first. Never returns a
   * chunk of another notebook.
   *
   * @throws com.flamingo.ai.notebookrag.exception.RetrievalException if embedding or search fails
   */
  List<ScoredChunk> search(String queryText, UUID notebookId, int limit);

  /** Removes every chunk of a notebook. No error if none exist. */
  void deleteByNotebook(UUID notebookId);

  /** Removes every chunk of a source. No error if none exist. */
  void deleteBySource(UUID sourceId);

  /** Makes recent writes visible to search. */
  void refresh();
}
