package com.flamingo.ai.notebookrag.elasticsearch;

import java.util.UUID;

/** Metadata every stored chunk carries. */
public record ChunkMetadata(
    UUID notebookId, UUID sourceId, String sourceTitle, String sourceKind, int chunkIndex) {}
