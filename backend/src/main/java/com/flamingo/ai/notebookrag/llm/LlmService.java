package com.flamingo.ai.notebookrag.llm;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.ProviderException.Reason;
import com.flamingo.ai.notebookrag.service.provider.ProviderConfigService;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Dispatches chat completions to the active provider configuration.
 *
 * <p>Stateless: the configuration is read and the model built on every call. Options are resolved
 * as built-in default, then caller override, then the provider's stored extra configuration, the
 * last one winning.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmService {

  private final ProviderConfigService providerConfigService;
  private final ProviderRegistry providerRegistry;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Sends a chat request with default options. Annotated separately because the call to the
   * two-argument overload below does not go through the Spring proxy.
   */
  @Timed(value = "llm.chat", description = "Time for a chat completion")
  @Retry(name = "llm")
  public LlmResponse chat(List<ChatTurn> turns) {
    return chat(turns, ChatOptions.none());
  }

  /**
   * Sends a chat request to the active provider.
   *
   * @param turns ordered conversation, system turn first if any
   * @param overrides caller-side option overrides, fields may be null
   * @return generated text tagged with provider and model
   * @throws ProviderException on backend failure or an empty answer
   * @throws com.flamingo.ai.notebookrag.exception.NoActiveProviderException if nothing is active
   */
  @Timed(value = "llm.chat", description = "Time for a chat completion")
  @Retry(name = "llm")
  public LlmResponse chat(List<ChatTurn> turns, ChatOptions overrides) {
    ProviderConfig config = providerConfigService.resolveActive();
    ProviderType type = ProviderType.fromValue(config.getProvider());
    ChatProvider provider = providerRegistry.chatProvider(type);
    ChatOptions options = resolveOptions(overrides, providerConfigService.extraConfig(config));

    log.debug(
        "Dispatching {} turns to {} / {} (temperature={}, maxTokens={})",
        turns.size(),
        type.value(),
        config.getModel(),
        options.temperature(),
        options.maxTokens());

    String text;
    try {
      ChatModel model = provider.chatModel(config, options);
      ChatResponse response = model.chat(toMessages(turns));
      text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
    } catch (RuntimeException e) {
      meterRegistry.counter("llm.requests.failure", "provider", type.value()).increment();
      ProviderException translated = ProviderFailures.translate(type.value(), e);
      log.error(
          "Chat call to {} failed ({}): {}", type.value(), translated.getReason(), e.getMessage());
      throw translated;
    }

    if (text == null || text.isBlank()) {
      meterRegistry.counter("llm.requests.failure", "provider", type.value()).increment();
      throw new ProviderException(
          Reason.INVALID_RESPONSE, type.value(), type.value() + " returned an empty answer");
    }
    meterRegistry.counter("llm.requests.success", "provider", type.value()).increment();
    return new LlmResponse(text, type.value(), config.getModel());
  }

  ChatOptions resolveOptions(ChatOptions overrides, Map<String, Object> extraConfig) {
    RagConfig.Llm llm = ragConfig.getLlm();
    return ChatOptions.of(llm.getDefaultTemperature(), llm.getDefaultMaxTokens())
        .overriddenBy(overrides)
        .overriddenBy(fromExtraConfig(extraConfig));
  }

  static ChatOptions fromExtraConfig(Map<String, Object> extraConfig) {
    Object temperature = extraConfig.get("temperature");
    Object maxTokens =
        extraConfig.containsKey("max_tokens")
            ? extraConfig.get("max_tokens")
            : extraConfig.get("maxTokens");
    return new ChatOptions(
        temperature instanceof Number t ? t.doubleValue() : null,
        maxTokens instanceof Number m ? m.intValue() : null);
  }

  static List<ChatMessage> toMessages(List<ChatTurn> turns) {
    return turns.stream().map(LlmService::toMessage).toList();
  }

  private static ChatMessage toMessage(ChatTurn turn) {
    return switch (turn.role()) {
      case SYSTEM -> SystemMessage.from(turn.content());
      case USER -> UserMessage.from(turn.content());
      case ASSISTANT -> AiMessage.from(turn.content());
    };
  }
}
