package com.flamingo.ai.chainsearch.service.chain;

import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import com.flamingo.ai.chainsearch.domain.model.MessageChain;
import com.flamingo.ai.chainsearch.domain.model.TranscriptEntry;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.service.transcript.TranscriptSnapshots;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Finds the run of messages that ends at a given message: same author, same channel or
 * conversation, no gap between consecutive messages larger than the configured idle gap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChainBuilder {

  private final MessageRepository messageRepository;
  private final ChainSearchConfig config;

  /**
   * Builds the chain ending at {@code messageId}.
   *
   * @return the chain oldest first, or empty if the message no longer exists
   */
  @Transactional(readOnly = true)
  public Optional<MessageChain> buildChain(Long messageId) {
    Optional<Message> found = messageRepository.findDetailedById(messageId);
    if (found.isEmpty()) {
      log.debug("Message {} no longer exists, no chain to build", messageId);
      return Optional.empty();
    }

    Message anchor = found.get();
    UUID authorId = anchor.getAuthor().getId();
    ChatContext chatContext = anchor.getChatContext();
    Pageable lookback = PageRequest.of(0, config.getChain().getLookback());

    List<Message> history = precedingByAuthor(anchor, lookback);

    List<TranscriptEntry> newestFirst = new ArrayList<>(history.size() + 1);
    newestFirst.add(TranscriptSnapshots.of(anchor));
    for (Message message : history) {
      if (!message.getId().equals(anchor.getId())) {
        newestFirst.add(TranscriptSnapshots.of(message));
      }
    }

    List<TranscriptEntry> entries = walkBack(newestFirst, config.getChain().getMaxIdleGap());
    log.debug(
        "Chain for message {} in {} has {} messages", messageId, chatContext.key(), entries.size());
    return Optional.of(
        new MessageChain(
            authorId, chatContext, TranscriptSnapshots.headingFor(anchor), entries));
  }

  /**
   * Finds the newest message of the run that {@code messageId} belongs to, looking forward in time.
   * For the author's latest message this is the message itself.
   *
   * @return the terminal message id, or empty if the message no longer exists
   */
  @Transactional(readOnly = true)
  public Optional<Long> findRunTerminal(Long messageId) {
    Optional<Message> found = messageRepository.findById(messageId);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    Message anchor = found.get();
    Pageable lookback = PageRequest.of(0, config.getChain().getLookback());
    Duration maxIdleGap = config.getChain().getMaxIdleGap();

    Message terminal = anchor;
    for (Message next : followingByAuthor(anchor, lookback)) {
      if (Duration.between(terminal.getCreatedAt(), next.getCreatedAt()).compareTo(maxIdleGap)
          > 0) {
        break;
      }
      terminal = next;
    }
    return Optional.of(terminal.getId());
  }

  /**
   * The author's message posted right before {@code message} in the same channel or conversation.
   */
  @Transactional(readOnly = true)
  public Optional<Long> findPreviousByAuthor(Message message) {
    return precedingByAuthor(message, PageRequest.of(0, 2)).stream()
        .map(Message::getId)
        .filter(id -> !id.equals(message.getId()))
        .findFirst();
  }

  /** The author's message posted right after {@code message} in the same place. */
  @Transactional(readOnly = true)
  public Optional<Long> findNextByAuthor(Message message) {
    return followingByAuthor(message, PageRequest.of(0, 1)).stream()
        .map(Message::getId)
        .findFirst();
  }

  private List<Message> precedingByAuthor(Message anchor, Pageable pageable) {
    UUID authorId = anchor.getAuthor().getId();
    ChatContext chatContext = anchor.getChatContext();
    return chatContext.isChannel()
        ? messageRepository.findAuthorChannelHistory(
            authorId, chatContext.channelId(), anchor.getCreatedAt(), anchor.getId(), pageable)
        : messageRepository.findAuthorConversationHistory(
            authorId,
            chatContext.conversationId(),
            anchor.getCreatedAt(),
            anchor.getId(),
            pageable);
  }

  private List<Message> followingByAuthor(Message anchor, Pageable pageable) {
    UUID authorId = anchor.getAuthor().getId();
    ChatContext chatContext = anchor.getChatContext();
    return chatContext.isChannel()
        ? messageRepository.findAuthorChannelFollowing(
            authorId, chatContext.channelId(), anchor.getCreatedAt(), anchor.getId(), pageable)
        : messageRepository.findAuthorConversationFollowing(
            authorId,
            chatContext.conversationId(),
            anchor.getCreatedAt(),
            anchor.getId(),
            pageable);
  }

  /**
   * Walks from the newest message backwards, stopping at the first gap larger than {@code
   * maxIdleGap}.
   *
   * @param newestFirst candidate messages, newest first; the first one always belongs to the chain
   * @return the chain, oldest first
   */
  static List<TranscriptEntry> walkBack(List<TranscriptEntry> newestFirst, Duration maxIdleGap) {
    List<TranscriptEntry> chain = new ArrayList<>();
    TranscriptEntry previous = null;
    for (TranscriptEntry entry : newestFirst) {
      if (previous != null
          && Duration.between(entry.createdAt(), previous.createdAt()).compareTo(maxIdleGap) > 0) {
        break;
      }
      chain.add(entry);
      previous = entry;
    }
    Collections.reverse(chain);
    return chain;
  }
}
