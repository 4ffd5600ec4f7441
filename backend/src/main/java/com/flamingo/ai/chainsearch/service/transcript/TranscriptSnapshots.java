package com.flamingo.ai.chainsearch.service.transcript;

import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.model.TranscriptAttachment;
import com.flamingo.ai.chainsearch.domain.model.TranscriptEntry;
import java.util.UUID;

/** Copies message entities into transcript snapshots. Must run inside the loading transaction. */
public final class TranscriptSnapshots {

  private TranscriptSnapshots() {}

  public static TranscriptEntry of(Message message) {
    return new TranscriptEntry(
        message.getId(),
        Profile.nameOf(message.getAuthor()),
        message.getContent(),
        message.getCreatedAt(),
        message.getAttachments().stream().map(TranscriptSnapshots::of).toList());
  }

  public static TranscriptAttachment of(Attachment attachment) {
    String raw = attachment.getRawDescription();
    if (raw == null) {
      raw = AttachmentDescriptionFormatter.strip(attachment.getDescription());
    }
    return new TranscriptAttachment(attachment.getCategory(), attachment.getFileName(), raw);
  }

  /**
   * Heading line for the place a message was posted in. For direct messages the recipient is seen
   * from the message author.
   */
  public static String headingFor(Message message) {
    if (message.getChannel() != null) {
      return "Channel: " + message.getChannel().getName();
    }
    if (message.getConversation() != null) {
      UUID authorId = message.getAuthor() != null ? message.getAuthor().getId() : null;
      return "Direct Message Recipient: "
          + message.getConversation().recipientNameFor(authorId);
    }
    return "";
  }
}
