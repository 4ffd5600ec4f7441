package com.flamingo.ai.chainsearch.domain.enums;

/** Broad media category of an attachment, derived from its MIME type. */
public enum AttachmentCategory {
  IMAGE("Image"),
  AUDIO("Audio"),
  VIDEO("Video"),
  TEXT("Text"),
  OTHER("File");

  private final String label;

  AttachmentCategory(String label) {
    this.label = label;
  }

  /** Label used in transcripts and description wrappers, e.g. "Image". */
  public String getLabel() {
    return label;
  }

  /** Whether descriptions of this category are rendered into transcripts. */
  public boolean isDescribed() {
    return this == IMAGE || this == AUDIO || this == VIDEO;
  }

  public static AttachmentCategory fromMimeType(String mimeType) {
    if (mimeType == null) {
      return OTHER;
    }
    if (mimeType.startsWith("image/")) {
      return IMAGE;
    }
    if (mimeType.startsWith("audio/")) {
      return AUDIO;
    }
    if (mimeType.startsWith("video/")) {
      return VIDEO;
    }
    if (mimeType.startsWith("text/")) {
      return TEXT;
    }
    return OTHER;
  }
}
