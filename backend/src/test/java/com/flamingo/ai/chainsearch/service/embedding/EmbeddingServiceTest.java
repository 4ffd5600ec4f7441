package com.flamingo.ai.chainsearch.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private ChainSearchConfig config;
  private SimpleMeterRegistry meterRegistry;
  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    config = new ChainSearchConfig();
    meterRegistry = new SimpleMeterRegistry();
    embeddingService = new EmbeddingService(embeddingModel, config, meterRegistry);
  }

  @Test
  @DisplayName("Should embed chain text with document prefix")
  void shouldEmbedDocument_withDocumentPrefix() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.4f, 0.5f, 0.6f));

    List<Float> result = embeddingService.embedDocument("[Ana, 09:00]: hi");

    assertThat(result).containsExactly(0.4f, 0.5f, 0.6f);
    verify(embeddingModel)
        .embed(config.getEmbedding().getDocumentPrefix() + "[Ana, 09:00]: hi");
    assertThat(meterRegistry.counter("embedding.requests.success", "type", "document").count())
        .isEqualTo(1);
  }

  @Test
  @DisplayName("Should embed search query with query prefix")
  void shouldEmbedQuery_withQueryPrefix() {
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f, 0.2f));

    List<Float> result = embeddingService.embedQuery("when is the deploy?");

    assertThat(result).containsExactly(0.1f, 0.2f);
    verify(embeddingModel).embed(config.getEmbedding().getQueryPrefix() + "when is the deploy?");
    assertThat(meterRegistry.timer("embedding.duration", "type", "query").count()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should truncate very long text")
  void shouldTruncateVeryLongText() {
    config.getEmbedding().setMaxChars(100);
    when(embeddingModel.embed(anyString())).thenReturn(createResponse(0.1f));

    embeddingService.embedDocument("a".repeat(6000));

    ArgumentCaptor<String> sent = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(sent.capture());
    assertThat(sent.getValue()).hasSize(100);
  }

  private static Response<Embedding> createResponse(float... vector) {
    return Response.from(Embedding.from(vector));
  }
}
