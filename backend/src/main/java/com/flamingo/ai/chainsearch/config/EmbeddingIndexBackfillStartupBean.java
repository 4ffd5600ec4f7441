package com.flamingo.ai.chainsearch.config;

import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.elasticsearch.MessageEmbeddingDocument;
import com.flamingo.ai.chainsearch.elasticsearch.MessageEmbeddingIndexService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Re-indexes stored chain embeddings on startup.
 *
 * <p>Rows are the source of truth. If Elasticsearch lost documents (new cluster, wiped volume, a
 * sync that failed for good) this brings the index back in line without calling the embedding
 * provider again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingIndexBackfillStartupBean implements CommandLineRunner {

  private static final int BATCH_SIZE = 50;

  private final MessageRepository messageRepository;
  private final MessageEmbeddingIndexService indexService;

  @Value("${chain-search.backfill.enabled:true}")
  private boolean enabled;

  @Override
  public void run(String... args) {
    if (!enabled) {
      return;
    }
    try {
      long total = messageRepository.countEmbedded();
      if (total == 0) {
        log.info("No chain embeddings stored, skipping index backfill");
        return;
      }

      log.info("Re-indexing {} stored chain embeddings", total);
      int indexed = 0;
      int page = 0;
      List<Message> batch;
      do {
        batch = messageRepository.findEmbedded(PageRequest.of(page++, BATCH_SIZE));
        List<MessageEmbeddingDocument> documents =
            batch.stream().map(EmbeddingIndexBackfillStartupBean::toDocument).toList();
        if (!documents.isEmpty() && indexService.upsertAll(documents)) {
          indexed += documents.size();
        }
      } while (batch.size() == BATCH_SIZE);

      log.info("Chain embedding backfill complete: indexed {}/{}", indexed, total);
    } catch (Exception e) {
      log.error("Chain embedding backfill failed: {}", e.getMessage(), e);
    }
  }

  private static MessageEmbeddingDocument toDocument(Message message) {
    return MessageEmbeddingDocument.builder()
        .messageId(message.getId())
        .authorId(message.getAuthor().getId().toString())
        .contextKey(message.getChatContext().key())
        .content(message.getContent())
        .context(message.getContext())
        .embedding(message.getEmbedding())
        .createdAt(message.getCreatedAt().toEpochMilli())
        .build();
  }
}
