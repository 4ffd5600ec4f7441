package com.flamingo.ai.chainsearch.service.embedding;

import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import com.flamingo.ai.chainsearch.domain.enums.EmbeddingMode;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings for chains (document mode) and search queries (query mode).
 *
 * <p>The two modes put different instruction prefixes in front of the text. Vectors produced in
 * one mode are only meant to be compared against vectors from the other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final ChainSearchConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds chain text for storage.
   *
   * @return the vector, or an empty list when the embedding provider is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedDocumentFallback")
  @Retry(name = "openai")
  public List<Float> embedDocument(String text) {
    return embed(text, EmbeddingMode.DOCUMENT);
  }

  /**
   * Embeds a search query.
   *
   * @return the vector, or an empty list when the embedding provider is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String text) {
    return embed(text, EmbeddingMode.QUERY);
  }

  private List<Float> embed(String text, EmbeddingMode mode) {
    String input = prefixFor(mode) + text;
    int maxChars = config.getEmbedding().getMaxChars();
    if (input.length() > maxChars) {
      log.warn(
          "Text too long for {} embedding, truncating from {} chars to {} chars",
          mode,
          input.length(),
          maxChars);
      input = input.substring(0, maxChars);
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(input);
      meterRegistry.counter("embedding.requests.success", "type", tag(mode)).increment();

      float[] vector = response.content().vector();
      log.debug("Generated {} embedding, dimension: {}", mode, vector.length);
      List<Float> result = new ArrayList<>(vector.length);
      for (float f : vector) {
        result.add(f);
      }
      return result;
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration", "type", tag(mode)));
    }
  }

  private String prefixFor(EmbeddingMode mode) {
    String prefix =
        mode == EmbeddingMode.QUERY
            ? config.getEmbedding().getQueryPrefix()
            : config.getEmbedding().getDocumentPrefix();
    return prefix != null ? prefix : "";
  }

  private static String tag(EmbeddingMode mode) {
    return mode.name().toLowerCase();
  }

  @SuppressWarnings("unused")
  private List<Float> embedDocumentFallback(String text, Throwable t) {
    return failed(EmbeddingMode.DOCUMENT, t);
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String text, Throwable t) {
    return failed(EmbeddingMode.QUERY, t);
  }

  private List<Float> failed(EmbeddingMode mode, Throwable t) {
    log.error("{} embedding failed, circuit breaker open: {}", mode, t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", tag(mode)).increment();
    return List.of();
  }
}
