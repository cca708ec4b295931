package com.flamingo.ai.notebookrag.elasticsearch;

/**
 * A search hit.
 *
 * @param chunk the stored chunk (without its embedding)
 * @param similarity cosine similarity to the query, {@code 1 - cosine distance}
 */
public record ScoredChunk(SourceChunk chunk, double similarity) {}
