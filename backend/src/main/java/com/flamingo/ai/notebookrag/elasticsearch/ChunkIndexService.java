package com.flamingo.ai.notebookrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.notebookrag.exception.ConfigurationException;
import com.flamingo.ai.notebookrag.exception.ProviderException;
import com.flamingo.ai.notebookrag.exception.RetrievalException;
import com.flamingo.ai.notebookrag.service.embedding.EmbeddingService;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch implementation of {@link VectorStore}.
 *
 * <p>Chunks live in one index with a cosine {@code dense_vector}. Every query carries a
 * {@code term} pre-filter on {@code notebookId}, so the kNN candidate set never contains another
 * notebook's chunks. Elasticsearch scores cosine kNN hits as {@code (1 + cos) / 2}; the score is
 * mapped back to cosine similarity.
 */
@Service
@Slf4j
public class ChunkIndexService implements VectorStore {

  private static final String NOTEBOOK_ID = "notebookId";
  private static final String SOURCE_ID = "sourceId";
  private static final String EMBEDDING = "embedding";
  private static final int MAX_NUM_CANDIDATES = 10_000;

  private final ElasticsearchClient elasticsearchClient;
  private final EmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.index-name:notebook-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      EmbeddingService embeddingService,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.embeddingService = embeddingService;
    this.meterRegistry = meterRegistry;
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      EmbeddingService embeddingService,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    this(elasticsearchClient, embeddingService, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  /** Creates the index on startup if it does not exist. */
  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            indexName);
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        // dynamic=false keeps undeclared fields out of the mapping
        CreateIndexRequest request =
            CreateIndexRequest.of(
                c ->
                    c.index(indexName)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
        indices.create(request);
        log.info("Created Elasticsearch index: {}", indexName);
      } else {
        log.debug("Elasticsearch index {} already exists", indexName);
      }
    } catch (Exception e) {
      log.error("Failed to initialize Elasticsearch index '{}': {}", indexName, e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + indexName + "'", e);
    }
  }

  @VisibleForTesting
  Map<String, Property> indexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ids must be keyword for exact term filtering
    properties.put(NOTEBOOK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(SOURCE_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put("sourceTitle", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("sourceKind", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "vector_store.insert", description = "Time to embed and store a chunk")
  public String insert(String chunkText, ChunkMetadata metadata) {
    // embedding failures propagate before anything is written
    List<Float> embedding = embeddingService.embed(chunkText);
    SourceChunk chunk =
        SourceChunk.builder()
            .id(SourceChunk.idOf(metadata.sourceId(), metadata.chunkIndex()))
            .notebookId(metadata.notebookId())
            .sourceId(metadata.sourceId())
            .sourceTitle(metadata.sourceTitle())
            .sourceKind(metadata.sourceKind())
            .chunkIndex(metadata.chunkIndex())
            .content(chunkText)
            .embedding(embedding)
            .build();
    try {
      Map<String, Object> document = toDocument(chunk);
      elasticsearchClient.index(i -> i.index(indexName).id(chunk.getId()).document(document));
      meterRegistry.counter("vector_store.inserted").increment();
      log.debug("Stored chunk {} of source {}", chunk.getId(), chunk.getSourceId());
      return chunk.getId();
    } catch (IOException e) {
      log.error("Failed to store chunk {}: {}", chunk.getId(), e.getMessage(), e);
      throw new RuntimeException("Failed to store chunk " + chunk.getId(), e);
    }
  }

  @Override
  @Timed(value = "vector_store.search", description = "Time for notebook-scoped vector search")
  @SuppressWarnings("rawtypes")
  public List<ScoredChunk> search(String queryText, UUID notebookId, int limit) {
    if (notebookId == null) {
      throw new IllegalArgumentException("notebookId is required for vector search");
    }
    List<Float> queryEmbedding;
    try {
      queryEmbedding = embeddingService.embed(queryText);
    } catch (ProviderException | ConfigurationException e) {
      meterRegistry.counter("vector_store.search.failure").increment();
      throw new RetrievalException("Failed to embed query: " + e.getMessage(), e);
    }

    try {
      SearchRequest request = buildVectorSearchRequest(notebookId, queryEmbedding, limit);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<ScoredChunk> results = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        ScoredChunk scored = toScoredChunk(hit);
        if (scored == null) {
          continue;
        }
        if (!notebookId.equals(scored.chunk().getNotebookId())) {
          log.warn(
              "Dropping chunk {} of notebook {} from search in notebook {}",
              hit.id(),
              scored.chunk().getNotebookId(),
              notebookId);
          continue;
        }
        results.add(scored);
      }
      results.sort((a, b) -> Double.compare(b.similarity(), a.similarity()));
      List<ScoredChunk> truncated = results.size() > limit ? results.subList(0, limit) : results;
      log.debug(
          "Vector search in notebook {} returned {} chunks", notebookId, truncated.size());
      meterRegistry.counter("vector_store.search").increment();
      return truncated;
    } catch (IOException | ElasticsearchException e) {
      meterRegistry.counter("vector_store.search.failure").increment();
      log.error("Vector search failed for notebook {}: {}", notebookId, e.getMessage(), e);
      throw new RetrievalException("Vector search failed", e);
    }
  }

  @Override
  public void deleteByNotebook(UUID notebookId) {
    deleteBy(NOTEBOOK_ID, notebookId);
  }

  @Override
  public void deleteBySource(UUID sourceId) {
    deleteBy(SOURCE_ID, sourceId);
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(indexName));
      log.debug("Refreshed index: {}", indexName);
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", indexName, e.getMessage());
    }
  }

  @VisibleForTesting
  SearchRequest buildVectorSearchRequest(UUID notebookId, List<Float> queryEmbedding, int limit) {
    int numCandidates = Math.min(Math.max(limit * 10, 100), MAX_NUM_CANDIDATES);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field(EMBEDDING)
                            .queryVector(queryEmbedding)
                            .k(limit)
                            .numCandidates(numCandidates)
                            .filter(
                                f -> f.term(t -> t.field(NOTEBOOK_ID).value(notebookId.toString()))))
                .source(src -> src.filter(f -> f.excludes(EMBEDDING)))
                .size(limit));
  }

  private void deleteBy(String field, UUID value) {
    try {
      Query query = Query.of(q -> q.term(t -> t.field(field).value(value.toString())));
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d -> d.index(indexName).query(query).conflicts(Conflicts.Proceed).refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      log.info(
          "Deleted {} chunks from {} where {}={}",
          response.deleted(),
          indexName,
          field,
          value);
      meterRegistry.counter("vector_store.deleted").increment();
    } catch (IOException e) {
      log.error("Failed to delete chunks where {}={}: {}", field, value, e.getMessage(), e);
      throw new RuntimeException("Failed to delete chunks", e);
    }
  }

  private Map<String, Object> toDocument(SourceChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(NOTEBOOK_ID, chunk.getNotebookId().toString());
    document.put(SOURCE_ID, chunk.getSourceId().toString());
    document.put("sourceTitle", chunk.getSourceTitle());
    document.put("sourceKind", chunk.getSourceKind());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("content", chunk.getContent());
    document.put(EMBEDDING, chunk.getEmbedding());
    return document;
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private ScoredChunk toScoredChunk(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    if (source == null) {
      return null;
    }
    Object chunkIndex = source.get("chunkIndex");
    SourceChunk chunk =
        SourceChunk.builder()
            .id(hit.id())
            .notebookId(UUID.fromString((String) source.get(NOTEBOOK_ID)))
            .sourceId(UUID.fromString((String) source.get(SOURCE_ID)))
            .sourceTitle((String) source.get("sourceTitle"))
            .sourceKind((String) source.get("sourceKind"))
            .chunkIndex(chunkIndex instanceof Number n ? n.intValue() : 0)
            .content((String) source.get("content"))
            .build();
    double score = hit.score() != null ? hit.score() : 0.0;
    return new ScoredChunk(chunk, 2 * score - 1);
  }
}
