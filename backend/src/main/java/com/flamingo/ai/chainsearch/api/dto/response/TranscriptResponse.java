package com.flamingo.ai.chainsearch.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a rendered channel or conversation history. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptResponse {

  /** {@code channel:<uuid>} or {@code conversation:<uuid>}. */
  private String contextKey;

  /** Empty when nothing has been posted yet. */
  private String transcript;
}
