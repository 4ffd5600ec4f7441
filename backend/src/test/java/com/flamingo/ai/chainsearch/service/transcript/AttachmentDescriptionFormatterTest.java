package com.flamingo.ai.chainsearch.service.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chainsearch.domain.enums.AttachmentCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AttachmentDescriptionFormatter Tests")
class AttachmentDescriptionFormatterTest {

  @Test
  @DisplayName("Should wrap description with sender, location and time")
  void shouldWrapDescription() {
    String formatted =
        AttachmentDescriptionFormatter.format(
            "Ana",
            "standup.m4a",
            AttachmentDescriptionFormatter.channelLocation("general"),
            "5 October 2023, 09:15",
            AttachmentCategory.AUDIO,
            "Two people discuss the release plan.");

    assertThat(formatted)
        .isEqualTo(
            "[Ana shared 'standup.m4a' in #general on 5 October 2023, 09:15. "
                + "Audio description: Two people discuss the release plan.]");
  }

  @Test
  @DisplayName("Should recover raw description from formatted text")
  void shouldRecoverRawDescription_whenStrippingFormattedText() {
    String raw = "A whiteboard. It lists [three] open bugs.";
    String formatted =
        AttachmentDescriptionFormatter.format(
            "Ben",
            "board.png",
            AttachmentDescriptionFormatter.directMessageLocation("Ana"),
            "5 October 2023, 10:00",
            AttachmentCategory.IMAGE,
            raw);

    assertThat(AttachmentDescriptionFormatter.strip(formatted)).isEqualTo(raw);
  }

  @Test
  @DisplayName("Should leave unwrapped text untouched")
  void shouldLeaveUnwrappedText_untouched() {
    assertThat(AttachmentDescriptionFormatter.strip("plain description [draft]"))
        .isEqualTo("plain description [draft]");
    assertThat(AttachmentDescriptionFormatter.strip(null)).isNull();
  }
}
