package com.flamingo.ai.chainsearch.domain.model;

import com.flamingo.ai.chainsearch.domain.enums.AttachmentCategory;

/** Attachment as it appears in a transcript. {@code description} is the raw describer text. */
public record TranscriptAttachment(
    AttachmentCategory category, String fileName, String description) {

  public boolean isRenderable() {
    return category.isDescribed() && description != null && !description.isBlank();
  }
}
