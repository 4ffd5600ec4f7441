package com.flamingo.ai.chainsearch.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Pending chain embedding run for one author in one channel or conversation.
 *
 * <p>Written in the same transaction as the message insert. New messages from the same author in
 * the same place re-arm the row instead of adding one, which debounces bursts.
 */
@Entity
@Table(
    name = "chain_embedding_tasks",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_chain_task_author_context",
            columnNames = {"author_id", "context_key"}),
    indexes = @Index(name = "idx_chain_task_due", columnList = "due_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainEmbeddingTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "author_id", nullable = false)
  private UUID authorId;

  @Column(name = "context_key", nullable = false)
  private String contextKey;

  @Column(name = "latest_message_id", nullable = false)
  private Long latestMessageId;

  /** Terminal of an earlier run in the same place, left behind when a deletion split a run. */
  @Column(name = "split_message_id")
  private Long splitMessageId;

  @Column(name = "due_at", nullable = false)
  private Instant dueAt;

  @Builder.Default private int attempts = 0;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  @Version private Long version;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = Instant.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  /** Points the task at a newer message and pushes its due time back. */
  public void rearm(Long messageId, Instant newDueAt) {
    this.latestMessageId = messageId;
    this.dueAt = newDueAt;
    this.attempts = 0;
    this.lastError = null;
  }

  /** Also runs the chain ending at {@code messageId} before the task is settled. */
  public void holdSplit(Long messageId) {
    this.splitMessageId = messageId;
  }

  /** Records a failed run and schedules the next attempt. */
  public void recordFailure(String error, Instant nextDueAt) {
    this.attempts++;
    this.lastError = error;
    this.dueAt = nextDueAt;
  }
}
