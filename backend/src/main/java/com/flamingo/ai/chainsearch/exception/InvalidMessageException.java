package com.flamingo.ai.chainsearch.exception;

/** Exception thrown when a message request breaks a structural rule, e.g. no target. */
public class InvalidMessageException extends RuntimeException {

  private final String userMessage;

  public InvalidMessageException(String userMessage) {
    super(userMessage);
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
