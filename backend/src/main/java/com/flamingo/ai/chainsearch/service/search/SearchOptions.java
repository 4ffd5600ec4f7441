package com.flamingo.ai.chainsearch.service.search;

/**
 * Per-request overrides of the configured search defaults. Null fields fall back to the
 * configuration.
 */
public record SearchOptions(Double similarityThreshold, Integer maxResults, Boolean includeChain) {

  public static SearchOptions defaults() {
    return new SearchOptions(null, null, null);
  }
}
