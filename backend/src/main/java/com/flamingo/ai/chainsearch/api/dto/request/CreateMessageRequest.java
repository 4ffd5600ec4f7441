package com.flamingo.ai.chainsearch.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for posting a message. Exactly one of channelId and conversationId must be set. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateMessageRequest {

  @NotNull(message = "Author is required")
  private UUID authorId;

  private UUID channelId;

  private UUID conversationId;

  /** Thread root when this message is a reply. */
  private Long parentId;

  @NotNull(message = "Content is required")
  @Size(max = 10000, message = "Content must not exceed 10000 characters")
  private String content;

  @Valid @Builder.Default private List<AttachmentMetadata> attachments = new ArrayList<>();

  /** File already uploaded to storage. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class AttachmentMetadata {

    @NotBlank(message = "File name is required")
    private String fileName;

    @NotBlank(message = "MIME type is required")
    private String mimeType;

    private String fileUrl;

    @PositiveOrZero private Long fileSize;
  }
}
