package com.flamingo.ai.chainsearch.domain.enums;

/**
 * Embedding adaptation. Stored chains are embedded as documents, search text as queries; the two
 * vectors are only meant to be compared with each other, not within the same mode.
 */
public enum EmbeddingMode {
  DOCUMENT,
  QUERY
}
