package com.flamingo.ai.chainsearch.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for the workspace assistant. The last turn must come from the user. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantChatRequest {

  /** Workspace member talking to the assistant, used to address them by name. */
  private UUID userId;

  @NotEmpty(message = "At least one message is required")
  @Size(max = 50, message = "At most 50 messages can be sent")
  @Valid
  private List<Turn> messages;

  /** One turn of the conversation with the assistant. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Turn {

    @NotBlank
    @Pattern(regexp = "user|assistant", message = "Role must be user or assistant")
    private String role;

    @NotBlank(message = "Content is required")
    @Size(max = 10000, message = "Content must not exceed 10000 characters")
    private String content;
  }
}
