package com.flamingo.ai.chainsearch.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>The chat model is tuned for the chain context step: low temperature and a hard cap on output
 * tokens, since it only ever returns one or two sentences.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.streaming-chat-model.max-tokens:1024}")
  private int streamingMaxTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  public ChatModel chatModel(ChainSearchConfig chainSearchConfig) {
    validateApiKey();
    ChainSearchConfig.Context context = chainSearchConfig.getContext();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(context.getTemperature())
        .maxTokens(context.getMaxTokens())
        .timeout(Duration.ofSeconds(30))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public StreamingChatModel streamingChatModel() {
    validateApiKey();

    return OpenAiStreamingChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxTokens(streamingMaxTokens)
        .timeout(Duration.ofSeconds(120))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
