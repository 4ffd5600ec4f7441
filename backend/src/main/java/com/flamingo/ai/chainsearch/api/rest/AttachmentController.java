package com.flamingo.ai.chainsearch.api.rest;

import com.flamingo.ai.chainsearch.api.dto.request.AttachmentDescriptionRequest;
import com.flamingo.ai.chainsearch.api.dto.response.MessageResponse.AttachmentResponse;
import com.flamingo.ai.chainsearch.domain.entity.Attachment;
import com.flamingo.ai.chainsearch.service.message.AttachmentService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Receives results from the external attachment describer. */
@RestController
@RequestMapping("/api/attachments")
@RequiredArgsConstructor
public class AttachmentController {

  private final AttachmentService attachmentService;

  @PutMapping("/{attachmentId}/description")
  public ResponseEntity<AttachmentResponse> recordDescription(
      @PathVariable UUID attachmentId, @Valid @RequestBody AttachmentDescriptionRequest request) {
    Attachment attachment =
        attachmentService.recordDescription(
            attachmentId, request.getCaption(), request.getDescription());
    return ResponseEntity.ok(AttachmentResponse.fromEntity(attachment));
  }
}
