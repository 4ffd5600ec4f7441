package com.flamingo.ai.chainsearch.api.dto.response;

import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.domain.entity.Profile;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for message data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

  private Long id;
  private UUID authorId;
  private String senderName;
  private UUID channelId;
  private UUID conversationId;
  private Long parentId;
  private String content;
  private Instant createdAt;

  /** Whether this message currently holds its chain's embedding. */
  private boolean embedded;

  private String context;
  private List<AttachmentResponse> attachments;

  /** Creates a MessageResponse from a Message entity. */
  public static MessageResponse fromEntity(Message message) {
    return MessageResponse.builder()
        .id(message.getId())
        .authorId(message.getAuthor().getId())
        .senderName(Profile.nameOf(message.getAuthor()))
        .channelId(message.getChannel() != null ? message.getChannel().getId() : null)
        .conversationId(
            message.getConversation() != null ? message.getConversation().getId() : null)
        .parentId(message.getParentId())
        .content(message.getContent())
        .createdAt(message.getCreatedAt())
        .embedded(message.hasEmbedding())
        .context(message.getContext())
        .attachments(
            message.getAttachments().stream().map(AttachmentResponse::fromEntity).toList())
        .build();
  }

  /** Attachment metadata and description. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class AttachmentResponse {
    private UUID id;
    private String fileName;
    private String mimeType;
    private String fileUrl;
    private Long fileSize;
    private String caption;
    private String description;

    public static AttachmentResponse fromEntity(Attachment attachment) {
      return AttachmentResponse.builder()
          .id(attachment.getId())
          .fileName(attachment.getFileName())
          .mimeType(attachment.getMimeType())
          .fileUrl(attachment.getFileUrl())
          .fileSize(attachment.getFileSize())
          .caption(attachment.getCaption())
          .description(attachment.getDescription())
          .build();
    }
  }
}
