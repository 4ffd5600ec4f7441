package com.flamingo.ai.chainsearch.service.chain;

import com.flamingo.ai.chainsearch.domain.model.MessageChain;
import com.flamingo.ai.chainsearch.exception.ChatContextNotFoundException;
import com.flamingo.ai.chainsearch.service.embedding.EmbeddingService;
import com.flamingo.ai.chainsearch.service.transcript.HistoryFormatter;
import com.flamingo.ai.chainsearch.service.transcript.TranscriptRenderer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the chain embedding pipeline for one message: build the chain, situate it in its
 * conversation, embed it and persist the result on the chain's newest message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChainEmbeddingProcessor {

  private final ChainBuilder chainBuilder;
  private final HistoryFormatter historyFormatter;
  private final TranscriptRenderer transcriptRenderer;
  private final ContextSynthesizer contextSynthesizer;
  private final EmbeddingService embeddingService;
  private final EmbeddingWriter embeddingWriter;
  private final MeterRegistry meterRegistry;

  /** Processes the chain ending at {@code messageId}. Never throws. */
  @Timed(value = "chain.process", description = "Time to contextualize and embed a chain")
  public ProcessingOutcome process(Long messageId) {
    ProcessingOutcome outcome;
    try {
      outcome = run(messageId);
    } catch (Exception e) {
      log.error("Chain processing failed for message {}: {}", messageId, e.getMessage(), e);
      outcome = ProcessingOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
    meterRegistry
        .counter("chain.processed", "outcome", outcome.status().name().toLowerCase())
        .increment();
    return outcome;
  }

  private ProcessingOutcome run(Long messageId) {
    Optional<MessageChain> built = chainBuilder.buildChain(messageId);
    if (built.isEmpty()) {
      log.info("Skipping chain processing, message {} no longer exists", messageId);
      return ProcessingOutcome.skipped();
    }

    MessageChain chain = built.get();
    String chainText = transcriptRenderer.render(chain.heading(), chain.entries());
    String context = contextSynthesizer.synthesize(transcriptOf(chain, chainText), chainText);
    String embeddingText = embeddingText(context, chainText);

    List<Float> embedding = embeddingService.embedDocument(embeddingText);
    if (embedding.isEmpty()) {
      return ProcessingOutcome.failed("Embedding provider returned no vector");
    }

    return switch (embeddingWriter.write(chain, embedding, context, chainText)) {
      case WRITTEN -> {
        log.info(
            "Embedded chain of {} messages ending at message {} ({} context)",
            chain.size(),
            chain.terminalMessageId(),
            context.isEmpty() ? "without" : "with");
        yield ProcessingOutcome.embedded(chain.size());
      }
      case MISSING -> ProcessingOutcome.skipped();
      case FAILED -> ProcessingOutcome.failed("Failed to persist chain embedding");
    };
  }

  private String transcriptOf(MessageChain chain, String chainText) {
    try {
      String transcript = historyFormatter.formatHistory(chain.chatContext());
      return transcript.isEmpty() ? chainText : transcript;
    } catch (ChatContextNotFoundException e) {
      log.warn("{} disappeared, situating chain in itself", chain.chatContext().key());
      return chainText;
    }
  }

  /** Text handed to the embedding model: the context line, if any, followed by the chain. */
  static String embeddingText(String context, String chainText) {
    if (context == null || context.isEmpty()) {
      return chainText;
    }
    return "Context: " + context + "\n" + chainText;
  }
}
