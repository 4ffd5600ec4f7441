package com.flamingo.ai.chainsearch.service.assistant;

import com.flamingo.ai.chainsearch.agent.WorkspaceAssistantAgent;
import com.flamingo.ai.chainsearch.api.dto.response.StreamChunkResponse;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.repository.ProfileRepository;
import com.flamingo.ai.chainsearch.exception.InvalidMessageException;
import com.flamingo.ai.chainsearch.service.search.MessageSearchService;
import com.flamingo.ai.chainsearch.service.search.SearchResult;
import com.flamingo.ai.chainsearch.service.transcript.TranscriptRenderer;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Implementation of {@link AssistantService} backed by a streaming chat model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssistantServiceImpl implements AssistantService {

  private static final int PREVIEW_CHARS = 100;

  private final WorkspaceAssistantAgent assistantAgent;
  private final MessageSearchService messageSearchService;
  private final ProfileRepository profileRepository;
  private final TranscriptRenderer transcriptRenderer;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  @Override
  public Flux<StreamChunkResponse> streamChat(UUID userId, List<AssistantTurn> turns) {
    if (turns.isEmpty() || turns.get(turns.size() - 1).role() != AssistantTurn.Role.USER) {
      throw new InvalidMessageException("The last message must come from the user");
    }
    AssistantTurn question = turns.get(turns.size() - 1);

    List<SearchResult> sources = messageSearchService.search(question.content());
    log.debug("Assistant found {} related messages", sources.size());

    List<ChatMessage> messages = buildMessages(userId, turns, sources);

    Sinks.Many<StreamChunkResponse> sink = Sinks.many().unicast().onBackpressureBuffer();
    AtomicInteger tokenCount = new AtomicInteger(0);

    try {
      assistantAgent
          .chat(messages)
          .onPartialResponse(
              token -> {
                tokenCount.incrementAndGet();
                var result = sink.tryEmitNext(StreamChunkResponse.token(token));
                if (result.isFailure()) {
                  log.warn("Failed to emit token: {}", result);
                }
              })
          .onCompleteResponse(
              response -> {
                for (SearchResult source : sources) {
                  sink.tryEmitNext(
                      StreamChunkResponse.source(
                          source.messageId(),
                          source.senderName(),
                          source.channelName(),
                          source.similarity(),
                          preview(source.content())));
                }
                meterRegistry.counter("assistant.replies").increment();
                meterRegistry.counter("assistant.tokens.generated").increment(tokenCount.get());
                sink.tryEmitNext(StreamChunkResponse.done(sources.size(), tokenCount.get()));
                sink.tryEmitComplete();
              })
          .onError(
              error -> {
                log.error("Error during assistant streaming: {}", error.getMessage(), error);
                meterRegistry.counter("assistant.errors").increment();
                sink.tryEmitNext(
                    StreamChunkResponse.error(
                        UUID.randomUUID().toString().substring(0, 8),
                        "The assistant is temporarily unavailable. Please try again later."));
                sink.tryEmitComplete();
              })
          .start();
    } catch (Exception e) {
      log.error("Assistant stream could not be started: {}", e.getMessage(), e);
      meterRegistry.counter("assistant.errors").increment();
      return Flux.just(
          StreamChunkResponse.error(
              UUID.randomUUID().toString().substring(0, 8),
              "The assistant is temporarily unavailable. Please try again later."));
    }

    return sink.asFlux();
  }

  /** Persona, earlier turns, current date, related messages, then the question. */
  List<ChatMessage> buildMessages(
      UUID userId, List<AssistantTurn> turns, List<SearchResult> sources) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(persona(userId)));

    for (AssistantTurn turn : turns.subList(0, turns.size() - 1)) {
      messages.add(
          turn.role() == AssistantTurn.Role.USER
              ? UserMessage.from(turn.content())
              : AiMessage.from(turn.content()));
    }

    messages.add(
        SystemMessage.from(
            "Current date and time: " + transcriptRenderer.formatLongDateTime(clock.instant())));

    if (!sources.isEmpty()) {
      messages.add(SystemMessage.from(contextMessage(sources)));
    }

    messages.add(UserMessage.from(turns.get(turns.size() - 1).content()));
    return messages;
  }

  private String persona(UUID userId) {
    String persona =
        "You are a helpful AI assistant for this workspace chat application. "
            + "Be friendly and conversational while remaining professional. "
            + "You can answer questions about messages posted in the workspace, "
            + "give general assistance or simply chat.";
    if (userId == null) {
      return persona;
    }
    return profileRepository
        .findById(userId)
        .map(profile -> persona + " You are chatting with " + profile.resolveName() + ".")
        .orElse(persona);
  }

  private String contextMessage(List<SearchResult> sources) {
    StringBuilder context =
        new StringBuilder(
            "Here are some relevant messages from the workspace that might help with the"
                + " response:\n\n");
    for (SearchResult source : sources) {
      context
          .append("[")
          .append(source.senderName() != null ? source.senderName() : Profile.UNKNOWN_USER)
          .append(" in ")
          .append(source.channelName() != null ? "#" + source.channelName() : "a direct message")
          .append(", ")
          .append(transcriptRenderer.formatDateTime(source.createdAt()))
          .append(String.format(Locale.ROOT, ", similarity %.2f", source.similarity()))
          .append("]: ")
          .append(source.content());
      if (source.chainTranscript() != null && !source.chainTranscript().isBlank()) {
        context.append("\nFull exchange:\n").append(source.chainTranscript());
      }
      context.append("\n\n");
    }
    context.append("Please use this context to inform your response when relevant.");
    return context.toString();
  }

  private static String preview(String content) {
    if (content == null) {
      return "";
    }
    if (content.length() <= PREVIEW_CHARS) {
      return content;
    }
    return content.substring(0, PREVIEW_CHARS) + "...";
  }
}
