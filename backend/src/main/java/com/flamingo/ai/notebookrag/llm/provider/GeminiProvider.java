package com.flamingo.ai.notebookrag.llm.provider;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.llm.ChatOptions;
import com.flamingo.ai.notebookrag.llm.ChatProvider;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Google AI Gemini. Assistant turns travel with the "model" role. */
@Component
@RequiredArgsConstructor
public class GeminiProvider implements ChatProvider {

  private final RagConfig ragConfig;

  @Override
  public ProviderType type() {
    return ProviderType.GEMINI;
  }

  @Override
  public ChatModel chatModel(ProviderConfig config, ChatOptions options) {
    return GoogleAiGeminiChatModel.builder()
        .apiKey(config.getApiKey())
        .modelName(config.getModel())
        .temperature(options.temperature())
        .maxOutputTokens(options.maxTokens())
        .timeout(ragConfig.getLlm().getTimeout())
        .build();
  }
}
