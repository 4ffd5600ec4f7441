package com.flamingo.ai.chainsearch.domain.entity;

import com.flamingo.ai.chainsearch.domain.enums.AttachmentCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A file attached to a message. Storage of the file itself happens elsewhere; this row keeps its
 * metadata and the caption/description produced by the attachment describer.
 *
 * <p>{@code rawDescription} holds the describer's text as-is. {@code description} holds the display
 * form with sender, channel and date baked in. Rows written before the raw column existed only have
 * the display form.
 */
@Entity
@Table(name = "attachments")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Attachment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "message_id", nullable = false)
  private Message message;

  @Column(nullable = false)
  private String fileName;

  @Column(nullable = false)
  private String mimeType;

  private String fileUrl;

  private Long fileSize;

  @Column(columnDefinition = "TEXT")
  private String caption;

  @Column(columnDefinition = "TEXT")
  private String rawDescription;

  @Column(columnDefinition = "TEXT")
  private String description;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public AttachmentCategory getCategory() {
    return AttachmentCategory.fromMimeType(mimeType);
  }
}
