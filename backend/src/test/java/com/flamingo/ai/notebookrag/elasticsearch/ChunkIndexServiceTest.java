package com.flamingo.ai.notebookrag.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch._types.KnnSearch;
import com.flamingo.ai.notebookrag.exception.ConfigurationException;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.RetrievalException;
import com.flamingo.ai.notebookrag.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkIndexService")
class ChunkIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private EmbeddingService embeddingService;

  private SimpleMeterRegistry meterRegistry;
  private ChunkIndexService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new ChunkIndexService(elasticsearchClient, embeddingService, meterRegistry, "test-chunks", 3);
  }

  @Nested
  @DisplayName("vector search request")
  class VectorSearchRequest {

    @Test
    @DisplayName("should restrict kNN candidates to the requested notebook")
    void shouldFilterByNotebook() {
      UUID notebookId = UUID.randomUUID();

      SearchRequest request =
          service.buildVectorSearchRequest(notebookId, List.of(0.1f, 0.2f, 0.3f), 5);

      assertThat(request.index()).containsExactly("test-chunks");
      assertThat(request.knn()).hasSize(1);
      KnnSearch knn = request.knn().get(0);
      assertThat(knn.field()).isEqualTo("embedding");
      assertThat(knn.k()).isEqualTo(5);
      assertThat(knn.numCandidates()).isEqualTo(100);
      assertThat(knn.filter()).hasSize(1);
      Query filter = knn.filter().get(0);
      assertThat(filter.isTerm()).isTrue();
      assertThat(filter.term().field()).isEqualTo("notebookId");
      assertThat(filter.term().value().stringValue()).isEqualTo(notebookId.toString());
      assertThat(request.size()).isEqualTo(5);
    }

    @Test
    @DisplayName("should scale candidates with the limit")
    void shouldScaleCandidates() {
      SearchRequest request =
          service.buildVectorSearchRequest(UUID.randomUUID(), List.of(0.1f, 0.2f, 0.3f), 50);

      assertThat(request.knn().get(0).numCandidates()).isEqualTo(500);
    }
  }

  @Nested
  @DisplayName("search")
  class Search {

    @Test
    @DisplayName("should reject a missing notebook id")
    void shouldRejectNullNotebook() {
      assertThatThrownBy(() -> service.search("question", null, 5))
          .isInstanceOf(IllegalArgumentException.class);

      verifyNoInteractions(embeddingService, elasticsearchClient);
    }

    @Test
    @DisplayName("should surface embedding provider failures as retrieval errors")
    void shouldWrapProviderFailure() {
      when(embeddingService.embed(anyString()))
          .thenThrow(
              new ProviderException(
                  ProviderException.Reason.NETWORK, "openai", "connection refused"));

      assertThatThrownBy(() -> service.search("question", UUID.randomUUID(), 5))
          .isInstanceOf(RetrievalException.class)
          .hasCauseInstanceOf(ProviderException.class);

      verifyNoInteractions(elasticsearchClient);
      assertThat(meterRegistry.counter("vector_store.search.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should surface embedding configuration failures as retrieval errors")
    void shouldWrapConfigurationFailure() {
      when(embeddingService.embed(anyString()))
          .thenThrow(new ConfigurationException("missing api key", "Configure an API key"));

      assertThatThrownBy(() -> service.search("question", UUID.randomUUID(), 5))
          .isInstanceOf(RetrievalException.class);
    }

    @Test
    @DisplayName("should surface server-side search errors as retrieval errors")
    void shouldWrapElasticsearchFailure() throws Exception {
      when(embeddingService.embed(anyString())).thenReturn(List.of(0.1f, 0.2f, 0.3f));
      ElasticsearchException dimensionMismatch =
          new ElasticsearchException(
              "search",
              ErrorResponse.of(
                  e ->
                      e.error(
                              c ->
                                  c.type("illegal_argument_exception")
                                      .reason("the query vector has a different dimension"))
                          .status(400)));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(dimensionMismatch);

      assertThatThrownBy(() -> service.search("question", UUID.randomUUID(), 5))
          .isInstanceOf(RetrievalException.class)
          .hasCause(dimensionMismatch);
      assertThat(meterRegistry.counter("vector_store.search.failure").count()).isEqualTo(1.0);
    }
  }

  @Test
  @DisplayName("insert should not write when embedding fails")
  void insertShouldNotWriteWhenEmbeddingFails() {
    when(embeddingService.embed(anyString()))
        .thenThrow(
            new ProviderException(ProviderException.Reason.RATE_LIMITED, "openai", "429"));
    ChunkMetadata metadata =
        new ChunkMetadata(UUID.randomUUID(), UUID.randomUUID(), "Paper", "pdf", 0);

    assertThatThrownBy(() -> service.insert("some text", metadata))
        .isInstanceOf(ProviderException.class);

    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("index mapping should declare a cosine dense vector with the configured dimensions")
  void indexPropertiesShouldDeclareDenseVector() {
    Map<String, Property> properties = service.indexProperties();

    assertThat(properties).containsKeys("notebookId", "sourceId", "content", "embedding");
    assertThat(properties.get("embedding").isDenseVector()).isTrue();
    assertThat(properties.get("embedding").denseVector().dims()).isEqualTo(3);
    assertThat(properties.get("notebookId").isKeyword()).isTrue();
  }

  @Test
  @DisplayName("chunk ids should be deterministic per source and position")
  void chunkIdShouldBeDeterministic() {
    UUID sourceId = UUID.fromString("00000000-0000-0000-0000-000000000001");

    assertThat(SourceChunk.idOf(sourceId, 4))
        .isEqualTo("00000000-0000-0000-0000-000000000001_4");
  }
}
