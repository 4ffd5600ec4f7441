package com.flamingo.ai.chainsearch.service.chain;

/**
 * Result of one chain embedding run.
 *
 * @param status what happened
 * @param chainSize number of messages in the chain, 0 when none was built
 * @param error failure description, null unless {@code status} is FAILED
 */
public record ProcessingOutcome(Status status, int chainSize, String error) {

  public enum Status {
    EMBEDDED,
    SKIPPED,
    FAILED
  }

  public static ProcessingOutcome embedded(int chainSize) {
    return new ProcessingOutcome(Status.EMBEDDED, chainSize, null);
  }

  public static ProcessingOutcome skipped() {
    return new ProcessingOutcome(Status.SKIPPED, 0, null);
  }

  public static ProcessingOutcome failed(String error) {
    return new ProcessingOutcome(Status.FAILED, 0, error);
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}
