package com.flamingo.ai.chainsearch.service.transcript;

import com.flamingo.ai.chainsearch.config.ChainSearchConfig;
import com.flamingo.ai.chainsearch.domain.model.TranscriptAttachment;
import com.flamingo.ai.chainsearch.domain.model.TranscriptEntry;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Renders transcript snapshots as plain text, one line per message:
 *
 * <pre>
 * Channel: general
 * Date: Thursday, 5 October 2023
 * [Ana, 09:15]: morning all
 * [Image: "board.png"] [Description: a whiteboard with ...]
 * </pre>
 *
 * <p>A date header is emitted whenever the calendar date changes. Dates and times use the
 * configured zone.
 */
@Component
public class TranscriptRenderer {

  private static final DateTimeFormatter DATE_HEADER =
      DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy", Locale.UK);
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.UK);
  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("d MMMM yyyy, HH:mm", Locale.UK);
  private static final DateTimeFormatter LONG_DATE_TIME =
      DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy 'at' HH:mm", Locale.UK);

  private final ZoneId zone;

  public TranscriptRenderer(ChainSearchConfig config) {
    this.zone = ZoneId.of(config.getFormatting().getZone());
  }

  public String render(String heading, List<TranscriptEntry> entries) {
    List<String> lines = new ArrayList<>();
    if (heading != null && !heading.isBlank()) {
      lines.add(heading);
    }
    LocalDate currentDate = null;
    for (TranscriptEntry entry : entries) {
      LocalDate date = entry.createdAt().atZone(zone).toLocalDate();
      if (!date.equals(currentDate)) {
        lines.add("Date: " + DATE_HEADER.format(date));
        currentDate = date;
      }
      lines.add(messageLine(entry));
      for (TranscriptAttachment attachment : entry.attachments()) {
        if (attachment.isRenderable()) {
          lines.add(attachmentLine(attachment));
        }
      }
    }
    return String.join("\n", lines);
  }

  /** {@code [sender, HH:mm]: content} */
  public String messageLine(TranscriptEntry entry) {
    return "["
        + entry.senderName()
        + ", "
        + TIME.format(entry.createdAt().atZone(zone))
        + "]: "
        + (entry.content() != null ? entry.content() : "");
  }

  /** {@code [Image: "file"] [Description: text]} */
  public String attachmentLine(TranscriptAttachment attachment) {
    return "["
        + attachment.category().getLabel()
        + ": \""
        + attachment.fileName()
        + "\"] [Description: "
        + attachment.description()
        + "]";
  }

  /** Date and time used inside attachment description wrappers. */
  public String formatDateTime(Instant instant) {
    return DATE_TIME.format(instant.atZone(zone));
  }

  /** e.g. {@code Thursday, 5 October 2023 at 09:15}. */
  public String formatLongDateTime(Instant instant) {
    return LONG_DATE_TIME.format(instant.atZone(zone));
  }
}
