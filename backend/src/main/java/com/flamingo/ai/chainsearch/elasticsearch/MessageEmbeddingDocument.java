package com.flamingo.ai.chainsearch.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chain embedding as stored in Elasticsearch. One document per message that currently holds its
 * chain's embedding; the relational row stays the source of truth.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageEmbeddingDocument {

  private Long messageId;

  private String authorId;

  /** {@code channel:<uuid>} or {@code conversation:<uuid>}. */
  private String contextKey;

  private String content;

  private String context;

  private List<Float> embedding;

  /** Epoch milliseconds. */
  private Long createdAt;
}
