package com.flamingo.ai.chainsearch.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a message, taken inside the read transaction so that rendering and the
 * LLM call never touch lazy entity state.
 */
public record TranscriptEntry(
    Long messageId,
    String senderName,
    String content,
    Instant createdAt,
    List<TranscriptAttachment> attachments) {

  public TranscriptEntry {
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }
}
