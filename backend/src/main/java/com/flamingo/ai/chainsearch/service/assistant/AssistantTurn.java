package com.flamingo.ai.chainsearch.service.assistant;

/** One turn of a conversation with the assistant. */
public record AssistantTurn(Role role, String content) {

  public enum Role {
    USER,
    ASSISTANT
  }

  public static AssistantTurn user(String content) {
    return new AssistantTurn(Role.USER, content);
  }

  public static AssistantTurn assistant(String content) {
    return new AssistantTurn(Role.ASSISTANT, content);
  }
}
