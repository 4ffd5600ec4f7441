package com.flamingo.ai.chainsearch.domain.entity;

import com.flamingo.ai.chainsearch.domain.converter.FloatListConverter;
import com.flamingo.ai.chainsearch.domain.model.ChatContext;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A chat message posted to a channel or a direct-message conversation.
 *
 * <p>The identity column doubles as arrival order: two messages with the same timestamp are
 * ordered by id. The {@code embedding}, {@code context} and {@code formattedChain} fields are owned
 * by the chain embedding pipeline; within one contiguous run of an author's messages only the
 * newest holds them.
 */
@Entity
@Table(
    name = "messages",
    indexes = {
      @Index(name = "idx_messages_channel_created", columnList = "channel_id, created_at"),
      @Index(
          name = "idx_messages_conversation_created",
          columnList = "conversation_id, created_at"),
      @Index(name = "idx_messages_author_created", columnList = "author_id, created_at")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Message {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "author_id", nullable = false)
  private Profile author;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "channel_id")
  private Channel channel;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id")
  private Conversation conversation;

  /** Root message of the thread this message replies to. */
  @Column(name = "parent_id")
  private Long parentId;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Convert(converter = FloatListConverter.class)
  @Column(columnDefinition = "TEXT")
  private List<Float> embedding;

  @Column(columnDefinition = "TEXT")
  private String context;

  @Column(name = "formatted_chain", columnDefinition = "TEXT")
  private String formattedChain;

  @OneToMany(mappedBy = "message", cascade = CascadeType.ALL, orphanRemoval = true)
  @OrderBy("createdAt ASC")
  @Builder.Default
  private List<Attachment> attachments = new ArrayList<>();

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public ChatContext getChatContext() {
    return channel != null
        ? ChatContext.ofChannel(channel.getId())
        : ChatContext.ofConversation(conversation.getId());
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }

  /** Makes this message the holder of its chain's embedding. */
  public void applyChainEmbedding(List<Float> embedding, String context, String formattedChain) {
    this.embedding = embedding;
    this.context = context == null || context.isBlank() ? null : context;
    this.formattedChain = formattedChain;
  }

  public void addAttachment(Attachment attachment) {
    attachment.setMessage(this);
    attachments.add(attachment);
  }
}
