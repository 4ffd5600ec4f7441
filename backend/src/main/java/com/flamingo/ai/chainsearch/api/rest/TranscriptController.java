package com.flamingo.ai.chainsearch.api.rest;

import com.flamingo.ai.chainsearch.api.dto.response.TranscriptResponse;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import com.flamingo.ai.chainsearch.service.transcript.HistoryFormatter;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Plain-text transcripts of channels and direct-message conversations. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TranscriptController {

  private final HistoryFormatter historyFormatter;

  @GetMapping("/channels/{channelId}/transcript")
  public ResponseEntity<TranscriptResponse> channelTranscript(@PathVariable UUID channelId) {
    return transcriptOf(ChatContext.ofChannel(channelId));
  }

  @GetMapping("/conversations/{conversationId}/transcript")
  public ResponseEntity<TranscriptResponse> conversationTranscript(
      @PathVariable UUID conversationId) {
    return transcriptOf(ChatContext.ofConversation(conversationId));
  }

  private ResponseEntity<TranscriptResponse> transcriptOf(ChatContext chatContext) {
    return ResponseEntity.ok(
        TranscriptResponse.builder()
            .contextKey(chatContext.key())
            .transcript(historyFormatter.formatHistory(chatContext))
            .build());
  }
}
