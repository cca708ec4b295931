package com.flamingo.ai.notebookrag.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.ProviderException.Reason;
import com.flamingo.ai.notebookrag.exception.UnsupportedProviderException;
import com.flamingo.ai.notebookrag.service.provider.ProviderConfigService;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LlmService Tests")
class LlmServiceTest {

  @Mock private ProviderConfigService providerConfigService;
  @Mock private ChatProvider openAiProvider;
  @Mock private ChatModel chatModel;

  private SimpleMeterRegistry meterRegistry;
  private LlmService llmService;
  private ProviderConfig openAiConfig;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    lenient().when(openAiProvider.type()).thenReturn(ProviderType.OPENAI);
    ProviderRegistry registry = new ProviderRegistry(List.of(openAiProvider), List.of());
    llmService = new LlmService(providerConfigService, registry, new RagConfig(), meterRegistry);

    openAiConfig =
        ProviderConfig.builder().provider("openai").model("gpt-4o-mini").apiKey("key").build();
  }

  @Nested
  @DisplayName("Option precedence")
  class OptionPrecedence {

    @Test
    @DisplayName("Should use built-in defaults when nothing is overridden")
    void shouldUseDefaults() {
      ChatOptions options = llmService.resolveOptions(ChatOptions.none(), Map.of());

      assertThat(options).isEqualTo(ChatOptions.of(0.7, 1000));
    }

    @Test
    @DisplayName("Should let caller override defaults")
    void shouldApplyCallerOverride() {
      ChatOptions options = llmService.resolveOptions(new ChatOptions(0.2, null), Map.of());

      assertThat(options).isEqualTo(ChatOptions.of(0.2, 1000));
    }

    @Test
    @DisplayName("Should let stored provider config win over the caller")
    void shouldApplyStoredConfigLast() {
      ChatOptions options =
          llmService.resolveOptions(
              ChatOptions.of(0.2, 300), Map.of("temperature", 0.9, "max_tokens", 500));

      assertThat(options).isEqualTo(ChatOptions.of(0.9, 500));
    }

    @Test
    @DisplayName("Should accept camel case max tokens and ignore non-numeric values")
    void shouldReadCamelCaseKey() {
      ChatOptions options =
          llmService.resolveOptions(
              ChatOptions.none(), Map.of("maxTokens", 64, "temperature", "hot"));

      assertThat(options).isEqualTo(ChatOptions.of(0.7, 64));
    }
  }

  @Test
  @DisplayName("Should map roles to LangChain4j message types in order")
  void shouldMapRoles() {
    List<ChatMessage> messages =
        LlmService.toMessages(
            List.of(ChatTurn.system("sys"), ChatTurn.user("hi"), ChatTurn.assistant("hello")));

    assertThat(messages).hasSize(3);
    assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
    assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
    assertThat(messages.get(2)).isInstanceOf(AiMessage.class);
    assertThat(((AiMessage) messages.get(2)).text()).isEqualTo("hello");
  }

  @Test
  @DisplayName("Should return text tagged with provider and model")
  void shouldReturnTaggedResponse() {
    when(providerConfigService.resolveActive()).thenReturn(openAiConfig);
    when(providerConfigService.extraConfig(openAiConfig)).thenReturn(Map.of());
    when(openAiProvider.chatModel(any(), any())).thenReturn(chatModel);
    when(chatModel.chat(anyList()))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Answer")).build());

    LlmResponse response = llmService.chat(List.of(ChatTurn.user("Question?")));

    assertThat(response).isEqualTo(new LlmResponse("Answer", "openai", "gpt-4o-mini"));
    verify(openAiProvider).chatModel(openAiConfig, ChatOptions.of(0.7, 1000));
    assertThat(meterRegistry.counter("llm.requests.success", "provider", "openai").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should reject an unknown provider name")
  void shouldRejectUnknownProvider() {
    when(providerConfigService.resolveActive())
        .thenReturn(ProviderConfig.builder().provider("mistral").model("m").build());

    assertThatThrownBy(() -> llmService.chat(List.of(ChatTurn.user("q"))))
        .isInstanceOf(UnsupportedProviderException.class)
        .extracting(e -> ((ProviderException) e).getReason())
        .isEqualTo(Reason.UNSUPPORTED_PROVIDER);
    verify(openAiProvider, never()).chatModel(any(), any());
  }

  @Test
  @DisplayName("Should reject a provider without a registered chat transport")
  void shouldRejectUnregisteredProvider() {
    when(providerConfigService.resolveActive())
        .thenReturn(ProviderConfig.builder().provider("anthropic").model("claude").build());

    assertThatThrownBy(() -> llmService.chat(List.of(ChatTurn.user("q"))))
        .isInstanceOf(UnsupportedProviderException.class);
  }

  @Test
  @DisplayName("Should fail with INVALID_RESPONSE on a blank answer")
  void shouldFailOnBlankAnswer() {
    when(providerConfigService.resolveActive()).thenReturn(openAiConfig);
    when(providerConfigService.extraConfig(openAiConfig)).thenReturn(Map.of());
    when(openAiProvider.chatModel(any(), any())).thenReturn(chatModel);
    when(chatModel.chat(anyList()))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("   ")).build());

    assertThatThrownBy(() -> llmService.chat(List.of(ChatTurn.user("q"))))
        .isInstanceOf(ProviderException.class)
        .extracting(e -> ((ProviderException) e).getReason())
        .isEqualTo(Reason.INVALID_RESPONSE);
    assertThat(meterRegistry.counter("llm.requests.failure", "provider", "openai").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should translate authentication failures")
  void shouldTranslateAuthenticationFailure() {
    when(providerConfigService.resolveActive()).thenReturn(openAiConfig);
    when(providerConfigService.extraConfig(openAiConfig)).thenReturn(Map.of());
    when(openAiProvider.chatModel(any(), any())).thenReturn(chatModel);
    when(chatModel.chat(anyList())).thenThrow(new AuthenticationException("invalid api key"));

    assertThatThrownBy(() -> llmService.chat(List.of(ChatTurn.user("q"))))
        .isInstanceOf(ProviderException.class)
        .satisfies(
            e -> {
              ProviderException pe = (ProviderException) e;
              assertThat(pe.getReason()).isEqualTo(Reason.AUTHENTICATION);
              assertThat(pe.isTransient()).isFalse();
              assertThat(pe.getProvider()).isEqualTo("openai");
            });
  }
}
