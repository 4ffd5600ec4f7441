package com.flamingo.ai.chainsearch.service.search;

import java.util.List;

/** Semantic search over chain embeddings. */
public interface MessageSearchService {

  /**
   * Finds the messages whose chains are most similar to {@code query}.
   *
   * @return hits in decreasing similarity; empty when nothing matches or search is unavailable
   */
  List<SearchResult> search(String query, SearchOptions options);

  default List<SearchResult> search(String query) {
    return search(query, SearchOptions.defaults());
  }
}
