package com.flamingo.ai.notebookrag.llm;

import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import dev.langchain4j.model.chat.ChatModel;

/**
 * Chat capability of one LLM backend.
 *
 * <p>Implementations build a new {@link ChatModel} for every call from the configuration row, so
 * configuration changes apply to the next call and no client is shared between requests. Role
 * naming is handled by the LangChain4j transport of each backend (assistant for OpenAI, Anthropic
 * and Ollama, model for Gemini).
 */
public interface ChatProvider {

  ProviderType type();

  /**
   * Builds a chat model for one call.
   *
   * @param config the active provider configuration
   * @param options fully resolved options; both fields are set
   * @return a chat model bound to the configuration and options
   */
  ChatModel chatModel(ProviderConfig config, ChatOptions options);
}
