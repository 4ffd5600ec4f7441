package com.flamingo.ai.chainsearch.service.message;

import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import com.flamingo.ai.chainsearch.domain.repository.AttachmentRepository;
import com.flamingo.ai.chainsearch.exception.AttachmentNotFoundException;
import com.flamingo.ai.chainsearch.service.chain.ChainBuilder;
import com.flamingo.ai.chainsearch.service.chain.ChainEmbeddingQueue;
import com.flamingo.ai.chainsearch.service.transcript.AttachmentDescriptionFormatter;
import com.flamingo.ai.chainsearch.service.transcript.TranscriptRenderer;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores what the attachment describer says about a file and feeds it back into the owning chain.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttachmentService {

  private final AttachmentRepository attachmentRepository;
  private final ChainBuilder chainBuilder;
  private final ChainEmbeddingQueue chainEmbeddingQueue;
  private final TranscriptRenderer transcriptRenderer;

  /**
   * Records a caption and description for an attachment, keeping the raw description next to its
   * display form, then re-queues the chain that contains the owning message.
   *
   * @throws AttachmentNotFoundException if the attachment does not exist
   */
  @Transactional
  public Attachment recordDescription(UUID attachmentId, String caption, String rawDescription) {
    Attachment attachment =
        attachmentRepository
            .findWithMessageById(attachmentId)
            .orElseThrow(() -> new AttachmentNotFoundException(attachmentId));
    Message message = attachment.getMessage();

    attachment.setCaption(caption);
    attachment.setRawDescription(rawDescription);
    attachment.setDescription(
        AttachmentDescriptionFormatter.format(
            Profile.nameOf(message.getAuthor()),
            attachment.getFileName(),
            locationOf(message),
            transcriptRenderer.formatDateTime(message.getCreatedAt()),
            attachment.getCategory(),
            rawDescription));
    attachmentRepository.save(attachment);

    chainBuilder
        .findRunTerminal(message.getId())
        .ifPresent(
            terminalId ->
                chainEmbeddingQueue.enqueue(
                    message.getAuthor().getId(), message.getChatContext(), terminalId));

    log.info(
        "Recorded {} description for attachment {} of message {}",
        attachment.getCategory().getLabel(),
        attachmentId,
        message.getId());
    return attachment;
  }

  private String locationOf(Message message) {
    if (message.getChannel() != null) {
      return AttachmentDescriptionFormatter.channelLocation(message.getChannel().getName());
    }
    return AttachmentDescriptionFormatter.directMessageLocation(
        message.getConversation().recipientNameFor(message.getAuthor().getId()));
  }
}
