package com.flamingo.ai.chainsearch.domain.model;

import java.util.List;
import java.util.UUID;

/**
 * A contiguous run of one author's messages in one channel or conversation, oldest first. The last
 * entry is the terminal message that will hold the chain's embedding.
 */
public record MessageChain(
    UUID authorId, ChatContext chatContext, String heading, List<TranscriptEntry> entries) {

  public MessageChain {
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("A chain holds at least one message");
    }
    entries = List.copyOf(entries);
  }

  public TranscriptEntry terminal() {
    return entries.get(entries.size() - 1);
  }

  public Long terminalMessageId() {
    return terminal().messageId();
  }

  /** Ids of every member except the terminal one. */
  public List<Long> earlierMessageIds() {
    return entries.subList(0, entries.size() - 1).stream()
        .map(TranscriptEntry::messageId)
        .toList();
  }

  public int size() {
    return entries.size();
  }
}
