package com.flamingo.ai.notebookrag.service.embedding;

import com.flamingo.ai.notebookrag.config.RagConfig;
import com.flamingo.ai.notebookrag.domain.entity.ProviderConfig;
import com.flamingo.ai.notebookrag.domain.enums.ProviderType;
import com.flamingo.ai.notebookrag.exception.NoEmbeddingProviderAvailableException;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.ProviderException.Reason;
import com.flamingo.ai.notebookrag.llm.EmbeddingProvider;
import com.flamingo.ai.notebookrag.llm.ProviderFailures;
import com.flamingo.ai.notebookrag.llm.ProviderRegistry;
import com.flamingo.ai.notebookrag.service.provider.ProviderConfigService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings with the active provider, falling back to an active OpenAI
 * configuration when the active provider cannot embed.
 *
 * <p>Changing the embedding provider changes the vector space; chunks embedded before the change
 * must be re-ingested by the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final ProviderConfigService providerConfigService;
  private final ProviderRegistry providerRegistry;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds one text.
   *
   * @param text the text to embed, truncated to the configured maximum
   * @return embedding vector
   * @throws ProviderException if the backend fails or returns an empty vector
   * @throws NoEmbeddingProviderAvailableException if no embedding-capable configuration is active
   */
  @Timed(value = "embedding.embed", description = "Time to embed text")
  @Retry(name = "embedding")
  public List<Float> embed(String text) {
    ProviderConfig config = resolveEmbeddingConfig();
    ProviderType type = ProviderType.fromValue(config.getProvider());
    EmbeddingProvider provider =
        providerRegistry
            .embeddingProvider(type)
            .orElseThrow(() -> new NoEmbeddingProviderAvailableException(type.value()));

    String input = text == null ? "" : text;
    int maxChars = ragConfig.getEmbedding().getMaxInputChars();
    if (input.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          input.length(),
          maxChars);
      input = input.substring(0, maxChars);
    }

    Response<Embedding> response;
    try {
      EmbeddingModel model = provider.embeddingModel(config);
      response = model.embed(input);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "provider", type.value()).increment();
      throw ProviderFailures.translate(type.value(), e);
    }

    if (response == null
        || response.content() == null
        || response.content().vector() == null
        || response.content().vector().length == 0) {
      meterRegistry.counter("embedding.requests.failure", "provider", type.value()).increment();
      throw new ProviderException(
          Reason.INVALID_RESPONSE, type.value(), type.value() + " returned an empty embedding");
    }
    meterRegistry.counter("embedding.requests.success", "provider", type.value()).increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Picks the active configuration if its provider can embed, otherwise the preferred active
   * OpenAI configuration.
   */
  ProviderConfig resolveEmbeddingConfig() {
    ProviderConfig active = providerConfigService.resolveActive();
    ProviderType activeType = ProviderType.fromValue(active.getProvider());
    if (providerRegistry.embeddingProvider(activeType).isPresent()) {
      return active;
    }
    Optional<ProviderConfig> fallback = providerConfigService.resolveActive(ProviderType.OPENAI);
    if (fallback.isEmpty()) {
      throw new NoEmbeddingProviderAvailableException(activeType.value());
    }
    log.debug(
        "Provider {} cannot embed, using OpenAI config {}", activeType, fallback.get().getId());
    return fallback.get();
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
