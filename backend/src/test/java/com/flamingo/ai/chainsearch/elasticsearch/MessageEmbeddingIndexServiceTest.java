package com.flamingo.ai.chainsearch.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageEmbeddingIndexService Tests")
class MessageEmbeddingIndexServiceTest {

  private static final List<Float> QUERY = List.of(0.1f, 0.2f, 0.3f);

  @Mock private ElasticsearchClient elasticsearchClient;

  private MessageEmbeddingIndexService indexService;

  @BeforeEach
  void setUp() {
    indexService = new MessageEmbeddingIndexService(elasticsearchClient, new SimpleMeterRegistry());
    ReflectionTestUtils.setField(indexService, "indexName", "test-messages");
  }

  @SuppressWarnings("unchecked")
  private void stubHits(Hit<Map>... hits) throws IOException {
    SearchResponse<Map> response = mock(SearchResponse.class);
    HitsMetadata<Map> metadata = mock(HitsMetadata.class);
    when(metadata.hits()).thenReturn(List.of(hits));
    when(response.hits()).thenReturn(metadata);
    doReturn(response).when(elasticsearchClient).search(any(SearchRequest.class), eq(Map.class));
  }

  @SuppressWarnings("unchecked")
  private static Hit<Map> hit(long messageId, double score) {
    Hit<Map> hit = mock(Hit.class);
    lenient().when(hit.score()).thenReturn(score);
    lenient().when(hit.source()).thenReturn(Map.of("messageId", messageId));
    return hit;
  }

  @Test
  @DisplayName("Should convert kNN score back to cosine similarity")
  void shouldConvertScore_toCosineSimilarity() throws IOException {
    stubHits(hit(5L, 0.71));

    List<MessageMatch> matches = indexService.matchMessages(QUERY, 0.3, 10);

    assertThat(matches).hasSize(1);
    assertThat(matches.get(0).messageId()).isEqualTo(5L);
    assertThat(matches.get(0).similarity()).isCloseTo(0.42, within(1e-9));
  }

  @Test
  @DisplayName("Should drop matches at or below the threshold")
  void shouldDropMatches_belowThreshold() throws IOException {
    stubHits(hit(5L, 0.71), hit(6L, 0.9));

    List<MessageMatch> matches = indexService.matchMessages(QUERY, 0.5, 10);

    assertThat(matches).extracting(MessageMatch::messageId).containsExactly(6L);
  }

  @Test
  @DisplayName("Should not query the index for an empty vector or zero count")
  void shouldSkipQuery_whenNothingToMatch() {
    assertThat(indexService.matchMessages(List.of(), 0.3, 10)).isEmpty();
    assertThat(indexService.matchMessages(QUERY, 0.3, 0)).isEmpty();
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should request at most count neighbours from the index")
  void shouldRequestCountNeighbours() throws IOException {
    stubHits();

    indexService.matchMessages(QUERY, 0.3, 4);

    ArgumentCaptor<SearchRequest> request = ArgumentCaptor.forClass(SearchRequest.class);
    verify(elasticsearchClient).search(request.capture(), eq(Map.class));
    assertThat(request.getValue().index()).containsExactly("test-messages");
    assertThat(request.getValue().knn()).hasSize(1);
    assertThat(request.getValue().knn().get(0).k()).isEqualTo(4);
    assertThat(request.getValue().knn().get(0).numCandidates()).isEqualTo(20);
  }

  @Test
  @DisplayName("Should report bulk delete failures")
  void shouldReportBulkDeleteFailure() throws IOException {
    BulkResponse response = mock(BulkResponse.class);
    when(response.errors()).thenReturn(true);
    when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(response);

    assertThat(indexService.deleteMessages(List.of(1L, 2L))).isFalse();
  }

  @Test
  @DisplayName("Should treat an empty delete as success")
  void shouldTreatEmptyDelete_asSuccess() {
    assertThat(indexService.deleteMessages(List.of())).isTrue();
    verifyNoInteractions(elasticsearchClient);
  }

  @Test
  @DisplayName("Should propagate client errors so the circuit breaker sees them")
  void shouldPropagateClientErrors() throws IOException {
    when(elasticsearchClient.bulk(any(BulkRequest.class))).thenThrow(new IOException("down"));

    assertThatThrownBy(() -> indexService.deleteMessages(List.of(1L)))
        .isInstanceOf(RuntimeException.class)
        .hasMessageContaining("Failed to delete chain embeddings");
  }

  @Test
  @DisplayName("Should create the index with a cosine dense vector field")
  @SuppressWarnings("unchecked")
  void shouldCreateIndex_withCosineVectorField() throws IOException {
    ElasticsearchIndicesClient indices = mock(ElasticsearchIndicesClient.class);
    when(elasticsearchClient.indices()).thenReturn(indices);
    when(indices.exists(any(Function.class))).thenReturn(new BooleanResponse(false));
    ReflectionTestUtils.setField(indexService, "vectorDimensions", 3);

    indexService.initIndex();

    ArgumentCaptor<CreateIndexRequest> created = ArgumentCaptor.forClass(CreateIndexRequest.class);
    verify(indices).create(created.capture());
    assertThat(created.getValue().index()).isEqualTo("test-messages");
    Property embedding = created.getValue().mappings().properties().get("embedding");
    assertThat(embedding.denseVector().dims()).isEqualTo(3);
    assertThat(embedding.denseVector().similarity()).isEqualTo(DenseVectorSimilarity.Cosine);
  }
}
