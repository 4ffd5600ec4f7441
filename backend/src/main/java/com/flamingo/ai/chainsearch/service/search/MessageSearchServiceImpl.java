package com.flamingo.ai.chainsearch.service.search;

import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.model.MessageChain;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.elasticsearch.MessageEmbeddingIndexService;
import com.flamingo.ai.chainsearch.elasticsearch.MessageMatch;
import com.flamingo.ai.chainsearch.service.chain.ChainBuilder;
import com.flamingo.ai.chainsearch.service.embedding.EmbeddingService;
import com.flamingo.ai.chainsearch.service.transcript.TranscriptRenderer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds the query, asks the vector index for the closest chain embeddings and hydrates each match
 * with sender, channel and optionally its chain transcript.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageSearchServiceImpl implements MessageSearchService {

  private final EmbeddingService embeddingService;
  private final MessageEmbeddingIndexService indexService;
  private final MessageRepository messageRepository;
  private final ChainBuilder chainBuilder;
  private final TranscriptRenderer transcriptRenderer;
  private final ChainSearchConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "message.search", description = "Time to run a semantic message search")
  public List<SearchResult> search(String query, SearchOptions options) {
    if (query == null || query.isBlank()) {
      return List.of();
    }

    try {
      double threshold =
          options.similarityThreshold() != null
              ? options.similarityThreshold()
              : config.getSearch().getSimilarityThreshold();
      int limit =
          options.maxResults() != null ? options.maxResults() : config.getSearch().getMaxResults();
      boolean includeChain =
          options.includeChain() != null
              ? options.includeChain()
              : config.getSearch().isIncludeChain();

      List<Float> queryEmbedding = embeddingService.embedQuery(query);
      if (queryEmbedding.isEmpty()) {
        log.warn("Query embedding unavailable, returning no results");
        meterRegistry.counter("message.search", "result", "no_embedding").increment();
        return List.of();
      }

      List<MessageMatch> matches = indexService.matchMessages(queryEmbedding, threshold, limit);
      if (matches.isEmpty()) {
        meterRegistry.counter("message.search", "result", "empty").increment();
        return List.of();
      }

      List<SearchResult> results = hydrate(matches, includeChain);
      log.debug(
          "Search returned {} results ({} matches, threshold {})",
          results.size(),
          matches.size(),
          threshold);
      meterRegistry.counter("message.search", "result", "success").increment();
      return results;
    } catch (Exception e) {
      log.error("Message search failed: {}", e.getMessage(), e);
      meterRegistry.counter("message.search", "result", "failure").increment();
      return List.of();
    }
  }

  /**
   * Keeps the index order. Matches whose message has been deleted, or whose message no longer
   * holds the chain embedding, are dropped.
   */
  private List<SearchResult> hydrate(List<MessageMatch> matches, boolean includeChain) {
    Map<Long, Message> messages =
        messageRepository
            .findWithSenderByIdIn(matches.stream().map(MessageMatch::messageId).toList())
            .stream()
            .collect(Collectors.toMap(Message::getId, Function.identity()));

    List<SearchResult> results = new ArrayList<>(matches.size());
    for (MessageMatch match : matches) {
      Message message = messages.get(match.messageId());
      if (message == null) {
        log.debug("Dropping match for deleted message {}", match.messageId());
        continue;
      }
      if (!message.hasEmbedding()) {
        log.debug("Dropping match for superseded message {}", match.messageId());
        continue;
      }
      results.add(
          new SearchResult(
              message.getId(),
              message.getContent(),
              message.getContext(),
              match.similarity(),
              Profile.nameOf(message.getAuthor()),
              message.getChannel() != null ? message.getChannel().getName() : null,
              message.getCreatedAt(),
              includeChain ? chainTranscript(message) : null));
    }
    return results;
  }

  private String chainTranscript(Message message) {
    if (message.getFormattedChain() != null && !message.getFormattedChain().isBlank()) {
      return message.getFormattedChain();
    }
    Optional<MessageChain> chain = chainBuilder.buildChain(message.getId());
    return chain.map(c -> transcriptRenderer.render(c.heading(), c.entries())).orElse(null);
  }
}
