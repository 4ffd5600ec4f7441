package com.flamingo.ai.chainsearch.service.assistant;

import com.flamingo.ai.chainsearch.api.dto.response.StreamChunkResponse;
import java.util.List;
import java.util.UUID;
import reactor.core.publisher.Flux;

/** Workspace assistant that answers questions using semantically related chat messages. */
public interface AssistantService {

  /**
   * Streams the assistant's reply to the last user turn.
   *
   * @param userId the member talking to the assistant, may be null
   * @param turns the conversation so far, oldest first, ending with a user turn
   * @return token events, then one source event per message used, then a done event; failures are
   *     reported as an error event
   */
  Flux<StreamChunkResponse> streamChat(UUID userId, List<AssistantTurn> turns);
}
