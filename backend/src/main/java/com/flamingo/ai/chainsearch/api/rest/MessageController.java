package com.flamingo.ai.chainsearch.api.rest;

import com.flamingo.ai.chainsearch.api.dto.request.CreateMessageRequest;
import com.flamingo.ai.chainsearch.api.dto.response.MessageResponse;
import com.flamingo.ai.chainsearch.domain.entity.Message;
import com.flamingo.ai.chainsearch.service.message.MessageService;
import com.flamingo.ai.chainsearch.service.message.NewMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for posting and deleting messages. */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
@Slf4j
public class MessageController {

  private final MessageService messageService;

  /**
   * Posts a message. Embedding of its chain happens later, once the author pauses.
   *
   * @param request the message to post
   * @return the created message
   */
  @PostMapping
  public ResponseEntity<MessageResponse> createMessage(
      @Valid @RequestBody CreateMessageRequest request) {
    Message message =
        messageService.createMessage(
            new NewMessage(
                request.getAuthorId(),
                request.getChannelId(),
                request.getConversationId(),
                request.getParentId(),
                request.getContent(),
                request.getAttachments().stream()
                    .map(
                        a ->
                            new NewMessage.NewAttachment(
                                a.getFileName(), a.getMimeType(), a.getFileUrl(), a.getFileSize()))
                    .toList()));
    return ResponseEntity.status(HttpStatus.CREATED).body(MessageResponse.fromEntity(message));
  }

  @GetMapping("/{messageId}")
  public ResponseEntity<MessageResponse> getMessage(@PathVariable Long messageId) {
    return ResponseEntity.ok(MessageResponse.fromEntity(messageService.getMessage(messageId)));
  }

  /**
   * Deletes a message.
   *
   * @param messageId the message ID
   * @return 204 No Content
   */
  @DeleteMapping("/{messageId}")
  public ResponseEntity<Void> deleteMessage(@PathVariable Long messageId) {
    log.info("Deleting message {}", messageId);
    messageService.deleteMessage(messageId);
    return ResponseEntity.noContent().build();
  }
}
