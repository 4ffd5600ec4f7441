package com.flamingo.ai.chainsearch.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Vector index over chain embeddings, used as the similarity lookup of message search.
 *
 * <p>The {@code embedding} field uses cosine similarity. Elasticsearch reports kNN hits with score
 * {@code (1 + cosine) / 2}; {@link #matchMessages} converts that back to the cosine similarity.
 */
@Service
@Slf4j
public class MessageEmbeddingIndexService {

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${elasticsearch.message-index-name:chain-search-messages}")
  private String indexName;

  @Value("${elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  public MessageEmbeddingIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping message index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch message embedding index: {}", indexName);
      }
    } catch (Exception e) {
      log.warn("Could not check/create Elasticsearch message index: {}", e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("messageId", Property.of(p -> p.long_(l -> l)));
    properties.put("authorId", Property.of(p -> p.keyword(k -> k)));
    properties.put("contextKey", Property.of(p -> p.keyword(k -> k)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("context", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("createdAt", Property.of(p -> p.long_(l -> l)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));

    CreateIndexRequest createIndexRequest =
        CreateIndexRequest.of(c -> c.index(indexName).mappings(m -> m.properties(properties)));

    elasticsearchClient.indices().create(createIndexRequest);
  }

  /**
   * Stores the chain embedding held by a message, replacing any previous document for it.
   *
   * @return whether the document was written
   */
  @Timed(value = "message_embedding.upsert", description = "Time to index a chain embedding")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertFallback")
  public boolean upsert(MessageEmbeddingDocument document) {
    try {
      elasticsearchClient.index(
          i ->
              i.index(indexName)
                  .id(String.valueOf(document.getMessageId()))
                  .document(toSource(document)));
      meterRegistry.counter("message_embedding.indexed").increment();
      log.debug("Indexed chain embedding of message {}", document.getMessageId());
      return true;
    } catch (Exception e) {
      log.error(
          "Failed to index chain embedding of message {}: {}",
          document.getMessageId(),
          e.getMessage(),
          e);
      throw new RuntimeException("Failed to index chain embedding", e);
    }
  }

  @SuppressWarnings("unused")
  private boolean upsertFallback(MessageEmbeddingDocument document, Throwable t) {
    log.warn("Chain embedding indexing fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_embedding.index.fallback").increment();
    return false;
  }

  /**
   * Indexes many chain embeddings in one bulk request.
   *
   * @return whether every document was written
   */
  @Timed(value = "message_embedding.bulk_upsert", description = "Time to bulk index embeddings")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "upsertAllFallback")
  public boolean upsertAll(List<MessageEmbeddingDocument> documents) {
    if (documents.isEmpty()) {
      return true;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (MessageEmbeddingDocument document : documents) {
        bulkBuilder.operations(
            op ->
                op.index(
                    idx ->
                        idx.index(indexName)
                            .id(String.valueOf(document.getMessageId()))
                            .document(toSource(document))));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        log.warn("Some chain embeddings failed to index: {}", response.items());
        return false;
      }
      meterRegistry.counter("message_embedding.indexed").increment(documents.size());
      return true;
    } catch (Exception e) {
      log.error("Failed to bulk index chain embeddings: {}", e.getMessage(), e);
      throw new RuntimeException("Failed to bulk index chain embeddings", e);
    }
  }

  @SuppressWarnings("unused")
  private boolean upsertAllFallback(List<MessageEmbeddingDocument> documents, Throwable t) {
    log.warn("Chain embedding bulk indexing fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_embedding.index.fallback").increment();
    return false;
  }

  /**
   * Removes the documents of the given messages. Messages without a document are ignored.
   *
   * @return whether the delete request succeeded
   */
  @Timed(value = "message_embedding.delete", description = "Time to delete chain embeddings")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "deleteMessagesFallback")
  public boolean deleteMessages(Collection<Long> messageIds) {
    if (messageIds.isEmpty()) {
      return true;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (Long messageId : messageIds) {
        bulkBuilder.operations(
            op -> op.delete(d -> d.index(indexName).id(String.valueOf(messageId))));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        log.warn("Some chain embeddings failed to delete: {}", response.items());
        return false;
      }
      meterRegistry.counter("message_embedding.deleted").increment(messageIds.size());
      return true;
    } catch (Exception e) {
      log.error("Failed to delete chain embeddings {}: {}", messageIds, e.getMessage(), e);
      throw new RuntimeException("Failed to delete chain embeddings", e);
    }
  }

  @SuppressWarnings("unused")
  private boolean deleteMessagesFallback(Collection<Long> messageIds, Throwable t) {
    log.warn("Chain embedding delete fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_embedding.delete.fallback").increment();
    return false;
  }

  /**
   * Finds the messages whose chain embedding is most similar to {@code queryEmbedding}.
   *
   * @param threshold minimum cosine similarity, exclusive
   * @param count maximum number of matches
   * @return matches ordered by decreasing similarity
   */
  @Timed(value = "message_embedding.match", description = "Time to match chain embeddings")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "matchMessagesFallback")
  public List<MessageMatch> matchMessages(
      List<Float> queryEmbedding, double threshold, int count) {
    if (queryEmbedding == null || queryEmbedding.isEmpty() || count <= 0) {
      return List.of();
    }
    try {
      SearchRequest searchRequest =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .source(src -> src.filter(f -> f.includes("messageId")))
                      .knn(
                          k ->
                              k.field("embedding")
                                  .queryVector(queryEmbedding)
                                  .k(count)
                                  .numCandidates(Math.max(count * 2, 20))
                                  .similarity((float) threshold))
                      .size(count));

      SearchResponse<Map> response = elasticsearchClient.search(searchRequest, Map.class);
      List<MessageMatch> matches = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        double score = hit.score() != null ? hit.score() : 0.0;
        double similarity = 2 * score - 1;
        if (similarity <= threshold) {
          continue;
        }
        Long messageId = messageIdOf(hit);
        if (messageId != null) {
          matches.add(new MessageMatch(messageId, similarity));
        }
      }

      meterRegistry.counter("message_embedding.match").increment();
      return matches;
    } catch (Exception e) {
      log.error("Chain embedding match failed: {}", e.getMessage(), e);
      throw new RuntimeException("Chain embedding match failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<MessageMatch> matchMessagesFallback(
      List<Float> queryEmbedding, double threshold, int count, Throwable t) {
    log.warn("Chain embedding match fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_embedding.match.fallback").increment();
    return List.of();
  }

  public String getIndexName() {
    return indexName;
  }

  private Long messageIdOf(Hit<Map> hit) {
    Map<?, ?> source = hit.source();
    if (source != null && source.get("messageId") instanceof Number number) {
      return number.longValue();
    }
    try {
      return hit.id() != null ? Long.valueOf(hit.id()) : null;
    } catch (NumberFormatException e) {
      log.warn("Ignoring hit with unexpected id {}", hit.id());
      return null;
    }
  }

  private Map<String, Object> toSource(MessageEmbeddingDocument document) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("messageId", document.getMessageId());
    doc.put("authorId", document.getAuthorId());
    doc.put("contextKey", document.getContextKey());
    doc.put("content", document.getContent());
    if (document.getContext() != null) {
      doc.put("context", document.getContext());
    }
    doc.put("embedding", document.getEmbedding());
    if (document.getCreatedAt() != null) {
      doc.put("createdAt", document.getCreatedAt());
    }
    return doc;
  }
}
