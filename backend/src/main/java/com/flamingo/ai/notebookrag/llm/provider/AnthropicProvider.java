package com.flamingo.ai.notebookrag.llm.provider;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.llm.ChatOptions;
import com.flamingo.ai.notebookrag.llm.ChatProvider;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Anthropic Messages API. System turns are sent as the top-level system prompt. */
@Component
@RequiredArgsConstructor
public class AnthropicProvider implements ChatProvider {

  private final RagConfig ragConfig;

  @Override
  public ProviderType type() {
    return ProviderType.ANTHROPIC;
  }

  @Override
  public ChatModel chatModel(ProviderConfig config, ChatOptions options) {
    var builder =
        AnthropicChatModel.builder()
            .apiKey(config.getApiKey())
            .modelName(config.getModel())
            .temperature(options.temperature())
            .maxTokens(options.maxTokens())
            .timeout(ragConfig.getLlm().getTimeout());
    if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
      builder.baseUrl(config.getBaseUrl());
    }
    return builder.build();
  }
}
