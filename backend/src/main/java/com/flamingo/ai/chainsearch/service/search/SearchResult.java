package com.flamingo.ai.chainsearch.service.search;

import java.time.Instant;

/**
 * One semantic search hit.
 *
 * @param similarity cosine similarity between the query and the chain embedding
 * @param channelName null for direct messages
 * @param chainTranscript the chain the embedding was built from, null unless requested
 */
public record SearchResult(
    Long messageId,
    String content,
    String context,
    double similarity,
    String senderName,
    String channelName,
    Instant createdAt,
    String chainTranscript) {}
