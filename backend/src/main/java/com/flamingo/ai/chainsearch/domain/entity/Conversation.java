package com.flamingo.ai.chainsearch.domain.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.JoinTable;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.Table;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A direct-message conversation between workspace members. Read-only for this service. */
@Entity
@Table(name = "conversations")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {

  @Id private UUID id;

  @ManyToMany(fetch = FetchType.LAZY)
  @JoinTable(
      name = "conversation_participants",
      joinColumns = @JoinColumn(name = "conversation_id"),
      inverseJoinColumns = @JoinColumn(name = "user_id"))
  @Builder.Default
  private Set<Profile> participants = new LinkedHashSet<>();

  /**
   * Name of the participant on the other side of the conversation, seen from {@code userId}.
   *
   * @return the recipient name, or "Unknown User" when nobody else takes part
   */
  public String recipientNameFor(UUID userId) {
    return participants.stream()
        .filter(p -> !Objects.equals(p.getId(), userId))
        .findFirst()
        .map(Profile::resolveName)
        .orElse(Profile.UNKNOWN_USER);
  }
}
