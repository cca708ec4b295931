package com.flamingo.ai.notebookrag.llm.provider;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.llm.ChatOptions;
import com.flamingo.ai.notebookrag.llm.ChatProvider;
import com.flamingo.ai.notebookrag.llm.EmbeddingProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Locally hosted Ollama server (chat and embeddings with the configured model). */
@Component
@RequiredArgsConstructor
public class OllamaProvider implements ChatProvider, EmbeddingProvider {

  private final RagConfig ragConfig;

  @Override
  public ProviderType type() {
    return ProviderType.OLLAMA;
  }

  @Override
  public ChatModel chatModel(ProviderConfig config, ChatOptions options) {
    return OllamaChatModel.builder()
        .baseUrl(baseUrl(config))
        .modelName(config.getModel())
        .temperature(options.temperature())
        .numPredict(options.maxTokens())
        .timeout(ragConfig.getLlm().getTimeout())
        .build();
  }

  @Override
  public EmbeddingModel embeddingModel(ProviderConfig config) {
    return OllamaEmbeddingModel.builder()
        .baseUrl(baseUrl(config))
        .modelName(config.getModel())
        .timeout(ragConfig.getLlm().getTimeout())
        .build();
  }

  private String baseUrl(ProviderConfig config) {
    String configured = config.getBaseUrl();
    return configured == null || configured.isBlank()
        ? ragConfig.getLlm().getOllamaBaseUrl()
        : configured;
  }
}
