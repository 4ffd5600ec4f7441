package com.flamingo.ai.chainsearch.service.chain;

/** Produces a short context that situates a chain within its surrounding conversation. */
public interface ContextSynthesizer {

  /**
   * Situates {@code chainText} within {@code transcript}.
   *
   * @return a 1-2 sentence context, or an empty string when none could be produced. Never throws.
   */
  String synthesize(String transcript, String chainText);
}
