package com.flamingo.ai.chainsearch.service.chain;

import com.flamingo.ai.chainsearch.agent.ChainContextAgent;
import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link ContextSynthesizer} backed by {@link ChainContextAgent}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmContextSynthesizer implements ContextSynthesizer {

  private final ChainContextAgent chainContextAgent;
  private final ChainSearchConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chain.context_synthesis", description = "Time to synthesize chain context")
  public String synthesize(String transcript, String chainText) {
    if (!config.getContext().isEnabled()) {
      return "";
    }
    if (chainText == null || chainText.isBlank()) {
      return "";
    }

    String conversation = tail(transcript == null ? "" : transcript);
    try {
      String context = chainContextAgent.situate(conversation, chainText);
      if (context == null || context.isBlank()) {
        meterRegistry.counter("chain.context", "result", "empty").increment();
        return "";
      }
      meterRegistry.counter("chain.context", "result", "success").increment();
      return context.trim();
    } catch (Exception e) {
      log.warn("Failed to synthesize chain context: {}", e.getMessage());
      meterRegistry.counter("chain.context", "result", "failure").increment();
      return "";
    }
  }

  /** Keeps the most recent part of the transcript within the configured budget. */
  private String tail(String transcript) {
    int max = config.getContext().getMaxTranscriptChars();
    if (transcript.length() <= max) {
      return transcript;
    }
    return transcript.substring(transcript.length() - max);
  }
}
