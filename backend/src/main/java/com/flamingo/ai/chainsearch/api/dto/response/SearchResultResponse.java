package com.flamingo.ai.chainsearch.api.dto.response;

import com.flamingo.ai.chainsearch.service.search.SearchResult;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a semantic search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultResponse {

  private Long messageId;
  private String content;
  private String context;
  private double similarity;
  private String senderName;

  /** Null for direct messages. */
  private String channelName;

  private Instant createdAt;
  private String chainTranscript;

  public static SearchResultResponse from(SearchResult result) {
    return SearchResultResponse.builder()
        .messageId(result.messageId())
        .content(result.content())
        .context(result.context())
        .similarity(result.similarity())
        .senderName(result.senderName())
        .channelName(result.channelName())
        .createdAt(result.createdAt())
        .chainTranscript(result.chainTranscript())
        .build();
  }
}
