package com.flamingo.ai.chainsearch.service.message;

import java.util.List;
import java.util.UUID;

/** A message to be posted, with the metadata of files already uploaded for it. */
public record NewMessage(
    UUID authorId,
    UUID channelId,
    UUID conversationId,
    Long parentId,
    String content,
    List<NewAttachment> attachments) {

  public NewMessage {
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  /** Uploaded file metadata. */
  public record NewAttachment(String fileName, String mimeType, String fileUrl, Long fileSize) {}
}
