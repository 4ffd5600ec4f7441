package com.flamingo.ai.chainsearch.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Caption and description produced by the attachment describer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentDescriptionRequest {

  @Size(max = 500, message = "Caption must not exceed 500 characters")
  private String caption;

  @NotBlank(message = "Description is required")
  @Size(max = 20000, message = "Description must not exceed 20000 characters")
  private String description;
}
