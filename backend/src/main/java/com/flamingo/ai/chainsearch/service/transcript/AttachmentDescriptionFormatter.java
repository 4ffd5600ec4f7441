package com.flamingo.ai.chainsearch.service.transcript;

import com.flamingo.ai.chainsearch.domain.enums.AttachmentCategory;
import java.util.regex.Pattern;

/**
 * Builds and strips the display form of attachment descriptions, for example:
 *
 * <pre>
 * [Ana shared 'standup.m4a' in #general on 5 October 2023, 09:15. Audio description: ...]
 * </pre>
 */
public final class AttachmentDescriptionFormatter {

  private static final Pattern WRAPPER_PREFIX =
      Pattern.compile("^\\[.*?\\. (Image|Audio|Video) description: ", Pattern.DOTALL);
  private static final Pattern WRAPPER_SUFFIX = Pattern.compile("\\]$");

  private AttachmentDescriptionFormatter() {}

  /**
   * Wraps a raw description with sender, location and time.
   *
   * @param location "#channel" or "a direct message with Name"
   * @param timestamp already formatted date and time
   */
  public static String format(
      String senderName,
      String fileName,
      String location,
      String timestamp,
      AttachmentCategory category,
      String rawDescription) {
    return "["
        + senderName
        + " shared '"
        + fileName
        + "' in "
        + location
        + " on "
        + timestamp
        + ". "
        + category.getLabel()
        + " description: "
        + rawDescription
        + "]";
  }

  /** Recovers the raw description from a display form. Unwrapped text is returned as-is. */
  public static String strip(String description) {
    if (description == null) {
      return null;
    }
    String withoutPrefix = WRAPPER_PREFIX.matcher(description).replaceFirst("");
    if (withoutPrefix.equals(description)) {
      return description;
    }
    return WRAPPER_SUFFIX.matcher(withoutPrefix).replaceFirst("");
  }

  /** Location phrase for a channel. */
  public static String channelLocation(String channelName) {
    return "#" + channelName;
  }

  /** Location phrase for a direct message. */
  public static String directMessageLocation(String recipientName) {
    return "a direct message with " + recipientName;
  }
}
