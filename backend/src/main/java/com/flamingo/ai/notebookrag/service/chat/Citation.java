package com.flamingo.ai.notebookrag.service.chat;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;

/** A pointer from an answer segment to the chunk it is attributed to. */
public record Citation(
    @JsonProperty("citation_id") int citationId,
    @JsonProperty("source_id") UUID sourceId,
    @JsonProperty("source_title") String sourceTitle,
    @JsonProperty("source_kind") String sourceKind,
    @JsonProperty("chunk_index") int chunkIndex,
    @JsonProperty("excerpt") String excerpt) {}
