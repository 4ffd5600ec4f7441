package com.flamingo.ai.chainsearch.service.transcript;

import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import com.flamingo.ai.chainsearch.domain.model.TranscriptEntry;
import com.flamingo.ai.chainsearch.domain.repository.ChannelRepository;
import com.flamingo.ai.chainsearch.domain.repository.ConversationRepository;
import com.flamingo.ai.chainsearch.domain.repository.MessageRepository;
import com.flamingo.ai.chainsearch.exception.ChatContextNotFoundException;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Renders the whole message history of a channel or a direct-message conversation. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryFormatter {

  private final MessageRepository messageRepository;
  private final ChannelRepository channelRepository;
  private final ConversationRepository conversationRepository;
  private final TranscriptRenderer renderer;

  /**
   * Formats the full history of {@code context}.
   *
   * @return the transcript, or an empty string when nothing has been posted yet
   * @throws ChatContextNotFoundException if the channel or conversation does not exist
   */
  @Timed(value = "transcript.format", description = "Time to format a chat transcript")
  @Transactional(readOnly = true)
  public String formatHistory(ChatContext context) {
    List<Message> messages;
    if (context.isChannel()) {
      if (!channelRepository.existsById(context.channelId())) {
        throw new ChatContextNotFoundException(context);
      }
      messages = messageRepository.findChannelHistory(context.channelId());
    } else {
      if (!conversationRepository.existsById(context.conversationId())) {
        throw new ChatContextNotFoundException(context);
      }
      messages = messageRepository.findConversationHistory(context.conversationId());
    }

    if (messages.isEmpty()) {
      return "";
    }

    List<TranscriptEntry> entries = messages.stream().map(TranscriptSnapshots::of).toList();
    String transcript =
        renderer.render(TranscriptSnapshots.headingFor(messages.get(0)), entries);
    log.debug(
        "Formatted {} messages of {} into {} chars",
        entries.size(),
        context.key(),
        transcript.length());
    return transcript;
  }
}
