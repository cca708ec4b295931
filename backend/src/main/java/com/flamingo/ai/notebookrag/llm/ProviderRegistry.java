package com.flamingo.ai.notebookrag.llm;

import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.exception.UnsupportedProviderException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Looks up the chat and embedding capability registered for each provider type. */
@Component
@Slf4j
public class ProviderRegistry {

  private final Map<ProviderType, ChatProvider> chatProviders = new EnumMap<>(ProviderType.class);
  private final Map<ProviderType, EmbeddingProvider> embeddingProviders =
      new EnumMap<>(ProviderType.class);

  public ProviderRegistry(
      List<ChatProvider> chatProviders, List<EmbeddingProvider> embeddingProviders) {
    chatProviders.forEach(p -> this.chatProviders.put(p.type(), p));
    embeddingProviders.forEach(p -> this.embeddingProviders.put(p.type(), p));
    log.info(
        "Registered chat providers {} and embedding providers {}",
        this.chatProviders.keySet(),
        this.embeddingProviders.keySet());
  }

  /**
   * Returns the chat capability of a provider.
   *
   * @throws UnsupportedProviderException if no chat provider is registered for the type
   */
  public ChatProvider chatProvider(ProviderType type) {
    ChatProvider provider = chatProviders.get(type);
    if (provider == null) {
      throw new UnsupportedProviderException(type.value());
    }
    return provider;
  }

  /** Returns the embedding capability of a provider, if it has one. */
  public Optional<EmbeddingProvider> embeddingProvider(ProviderType type) {
    return Optional.ofNullable(embeddingProviders.get(type));
  }
}
