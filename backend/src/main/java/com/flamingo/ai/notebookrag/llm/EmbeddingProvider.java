package com.flamingo.ai.notebookrag.llm;

import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import dev.langchain4j.model.embedding.EmbeddingModel;

/** Embedding capability of an LLM backend. Only some providers implement it. */
public interface EmbeddingProvider {

  ProviderType type();

  EmbeddingModel embeddingModel(ProviderConfig config);
}
