package com.flamingo.ai.chainsearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Runs the embedding service through its Spring proxy so the circuit breaker fallbacks apply. */
@SpringBootTest
@DisplayName("EmbeddingService Fallback Tests")
class EmbeddingServiceFallbackTest {

  @MockitoBean private ChatModel chatModel;
  @MockitoBean private StreamingChatModel streamingChatModel;
  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private EmbeddingService embeddingService;
  @Autowired private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("provider down"));
  }

  @Test
  @DisplayName("Should return an empty query vector when the provider fails")
  void shouldReturnEmptyQueryVector_whenProviderFails() {
    double failuresBefore = failures("query");

    assertThat(embeddingService.embedQuery("when is the deploy?")).isEmpty();
    assertThat(failures("query")).isGreaterThan(failuresBefore);
  }

  @Test
  @DisplayName("Should return an empty document vector when the provider fails")
  void shouldReturnEmptyDocumentVector_whenProviderFails() {
    double failuresBefore = failures("document");

    assertThat(embeddingService.embedDocument("[Ana, 09:00]: hi")).isEmpty();
    assertThat(failures("document")).isGreaterThan(failuresBefore);
  }

  private double failures(String type) {
    return meterRegistry.counter("embedding.requests.failure", "type", type).count();
  }
}
