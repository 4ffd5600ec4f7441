package com.flamingo.ai.chainsearch.domain.model;

import java.util.UUID;

/**
 * The channel or direct-message conversation a message belongs to. Exactly one of the two ids is
 * set.
 */
public record ChatContext(UUID channelId, UUID conversationId) {

  public ChatContext {
    if ((channelId == null) == (conversationId == null)) {
      throw new IllegalArgumentException(
          "Exactly one of channelId or conversationId must be set");
    }
  }

  public static ChatContext ofChannel(UUID channelId) {
    return new ChatContext(channelId, null);
  }

  public static ChatContext ofConversation(UUID conversationId) {
    return new ChatContext(null, conversationId);
  }

  public boolean isChannel() {
    return channelId != null;
  }

  public UUID id() {
    return isChannel() ? channelId : conversationId;
  }

  /** Stable key, e.g. {@code channel:3f0c...}, used to coalesce queued chain runs. */
  public String key() {
    return (isChannel() ? "channel:" : "conversation:") + id();
  }
}
