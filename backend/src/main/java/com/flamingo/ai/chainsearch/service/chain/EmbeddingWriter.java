package com.flamingo.ai.chainsearch.service.chain;

import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.model.MessageChain;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.elasticsearch.MessageEmbeddingDocument;
import com.flamingo.ai.chainsearch.elasticsearch.MessageEmbeddingIndexService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists a chain's embedding on its terminal message and takes it away from every earlier
 * member.
 *
 * <p>Both row updates run in one transaction, terminal write first. The Elasticsearch index is
 * synchronised after commit; a failed sync is reported so the run is retried, which rewrites the
 * same values.
 */
@Service
@Slf4j
public class EmbeddingWriter {

  /** Result of a write. */
  public enum WriteResult {
    WRITTEN,
    /** The terminal message was deleted before the write. */
    MISSING,
    FAILED
  }

  private final MessageRepository messageRepository;
  private final MessageEmbeddingIndexService indexService;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;

  public EmbeddingWriter(
      MessageRepository messageRepository,
      MessageEmbeddingIndexService indexService,
      PlatformTransactionManager transactionManager,
      MeterRegistry meterRegistry) {
    this.messageRepository = messageRepository;
    this.indexService = indexService;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.meterRegistry = meterRegistry;
  }

  @Timed(value = "chain.embedding_write", description = "Time to persist a chain embedding")
  public WriteResult write(
      MessageChain chain, List<Float> embedding, String context, String formattedChain) {
    List<Long> earlierIds = chain.earlierMessageIds();

    Optional<MessageEmbeddingDocument> written;
    try {
      written =
          transactionTemplate.execute(
              status -> writeRows(chain, earlierIds, embedding, context, formattedChain));
    } catch (Exception e) {
      log.error(
          "Failed to write chain embedding on message {}: {}",
          chain.terminalMessageId(),
          e.getMessage(),
          e);
      meterRegistry.counter("chain.embedding_write", "result", "failed").increment();
      return WriteResult.FAILED;
    }

    if (written == null || written.isEmpty()) {
      log.debug("Terminal message {} vanished before write", chain.terminalMessageId());
      meterRegistry.counter("chain.embedding_write", "result", "missing").increment();
      return WriteResult.MISSING;
    }

    boolean indexed = indexService.upsert(written.get());
    boolean superseded = indexService.deleteMessages(earlierIds);
    if (!indexed || !superseded) {
      log.warn(
          "Chain embedding of message {} stored but index sync failed (indexed={}, superseded={})",
          chain.terminalMessageId(),
          indexed,
          superseded);
      meterRegistry.counter("chain.embedding_write", "result", "index_failed").increment();
      return WriteResult.FAILED;
    }

    meterRegistry.counter("chain.embedding_write", "result", "written").increment();
    return WriteResult.WRITTEN;
  }

  private Optional<MessageEmbeddingDocument> writeRows(
      MessageChain chain,
      List<Long> earlierIds,
      List<Float> embedding,
      String context,
      String formattedChain) {
    Optional<Message> terminal = messageRepository.findById(chain.terminalMessageId());
    if (terminal.isEmpty()) {
      return Optional.empty();
    }

    Message message = terminal.get();
    message.applyChainEmbedding(embedding, context, formattedChain);
    messageRepository.saveAndFlush(message);
    MessageEmbeddingDocument document = toDocument(chain, message);

    if (!earlierIds.isEmpty()) {
      int cleared = messageRepository.clearEmbeddings(earlierIds);
      log.debug(
          "Cleared {} superseded embeddings for chain ending at message {}",
          cleared,
          message.getId());
    }
    return Optional.of(document);
  }

  private MessageEmbeddingDocument toDocument(MessageChain chain, Message message) {
    return MessageEmbeddingDocument.builder()
        .messageId(message.getId())
        .authorId(chain.authorId().toString())
        .contextKey(chain.chatContext().key())
        .content(message.getContent())
        .context(message.getContext())
        .embedding(message.getEmbedding())
        .createdAt(message.getCreatedAt().toEpochMilli())
        .build();
  }
}
