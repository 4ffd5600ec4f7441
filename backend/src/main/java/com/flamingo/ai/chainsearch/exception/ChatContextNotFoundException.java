package com.flamingo.ai.chainsearch.exception;

import com.flamingo.ai.chainsearch.domain.model.ChatContext;

/** Exception thrown when a channel or conversation does not exist. */
public class ChatContextNotFoundException extends RuntimeException {

  private final ChatContext chatContext;

  public ChatContextNotFoundException(ChatContext chatContext) {
    super(
        (chatContext.isChannel() ? "Channel" : "Conversation")
            + " not found: "
            + chatContext.id());
    this.chatContext = chatContext;
  }

  public ChatContext getChatContext() {
    return chatContext;
  }
}
