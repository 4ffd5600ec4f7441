package com.flamingo.ai.chainsearch.service.message;

import com.flamingo.ai.chainsearch.domain.entity.Message;

/** Service for posting and removing chat messages. */
public interface MessageService {

  /**
   * Posts a message and schedules embedding of the chain it ends.
   *
   * @throws com.flamingo.ai.chainsearch.exception.InvalidMessageException if the message has no
   *     single target or references an unknown parent
   * @throws com.flamingo.ai.chainsearch.exception.ProfileNotFoundException if the author is unknown
   * @throws com.flamingo.ai.chainsearch.exception.ChatContextNotFoundException if the channel or
   *     conversation is unknown
   */
  Message createMessage(NewMessage newMessage);

  /**
   * Gets a message with its author, target and attachments loaded.
   *
   * @throws com.flamingo.ai.chainsearch.exception.MessageNotFoundException if not found
   */
  Message getMessage(Long messageId);

  /**
   * Deletes a message and its attachments. The author's neighbouring chain is re-embedded so that
   * it stops describing the deleted text.
   *
   * @throws com.flamingo.ai.chainsearch.exception.MessageNotFoundException if not found
   */
  void deleteMessage(Long messageId);
}
