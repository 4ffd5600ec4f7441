package com.flamingo.ai.chainsearch.api.sse;

import com.flamingo.ai.chainsearch.api.dto.request.AssistantChatRequest;
import com.flamingo.ai.chainsearch.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.chainsearch.service.assistant.AssistantService;
import com.flamingo.ai.chainsearch.service.assistant.AssistantTurn;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for the workspace assistant with SSE streaming. */
@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
@Slf4j
public class AssistantController {

  private final AssistantService assistantService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams the assistant's answer using Server-Sent Events.
   *
   * @param request the conversation so far, ending with the user's question
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamChunkResponse> streamChat(@Valid @RequestBody AssistantChatRequest request) {
    List<AssistantTurn> turns =
        request.getMessages().stream()
            .map(
                t ->
                    "user".equals(t.getRole())
                        ? AssistantTurn.user(t.getContent())
                        : AssistantTurn.assistant(t.getContent()))
            .toList();

    log.info("Starting assistant stream with {} turns", turns.size());
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return assistantService
        .streamChat(request.getUserId(), turns)
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Assistant stream completed");
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Assistant stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Assistant stream cancelled");
            });
  }
}
