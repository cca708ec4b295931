package com.flamingo.ai.notebookrag.llm.provider;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.llm.ChatOptions;
import com.flamingo.ai.notebookrag.llm.ChatProvider;
import com.flamingo.ai.notebookrag.llm.EmbeddingProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** OpenAI and OpenAI-compatible endpoints (chat and embeddings). */
@Component
@RequiredArgsConstructor
public class OpenAiProvider implements ChatProvider, EmbeddingProvider {

  private final RagConfig ragConfig;

  @Override
  public ProviderType type() {
    return ProviderType.OPENAI;
  }

  @Override
  public ChatModel chatModel(ProviderConfig config, ChatOptions options) {
    return OpenAiChatModel.builder()
        .apiKey(config.getApiKey())
        .baseUrl(blankToNull(config.getBaseUrl()))
        .modelName(config.getModel())
        .temperature(options.temperature())
        .maxTokens(options.maxTokens())
        .timeout(ragConfig.getLlm().getTimeout())
        .build();
  }

  /** Embeddings use the deployment-wide model so every chunk shares one vector space. */
  @Override
  public EmbeddingModel embeddingModel(ProviderConfig config) {
    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    return OpenAiEmbeddingModel.builder()
        .apiKey(config.getApiKey())
        .baseUrl(blankToNull(config.getBaseUrl()))
        .modelName(embedding.getOpenAiModel())
        .dimensions(embedding.getDimensions())
        .timeout(ragConfig.getLlm().getTimeout())
        .build();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
