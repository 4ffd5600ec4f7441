package com.flamingo.ai.chainsearch.api.rest;

import com.flamingo.ai.chainsearch.api.dto.request.SearchRequest;
import com.flamingo.ai.chainsearch.api.dto.response.SearchResultResponse;
import com.flamingo.ai.chainsearch.service.search.MessageSearchService;
import com.flamingo.ai.chainsearch.service.search.SearchOptions;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for semantic message search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

  private final MessageSearchService messageSearchService;

  /**
   * Searches messages by meaning.
   *
   * @param request the query and optional tuning overrides
   * @return hits in decreasing similarity, empty when search is unavailable
   */
  @PostMapping
  public ResponseEntity<List<SearchResultResponse>> search(
      @Valid @RequestBody SearchRequest request) {
    log.debug("Searching messages, query length {}", request.getQuery().length());
    List<SearchResultResponse> results =
        messageSearchService
            .search(
                request.getQuery(),
                new SearchOptions(
                    request.getSimilarityThreshold(),
                    request.getMaxResults(),
                    request.getIncludeChain()))
            .stream()
            .map(SearchResultResponse::from)
            .toList();
    return ResponseEntity.ok(results);
  }
}
