package com.flamingo.ai.chainsearch.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A workspace member. Read-only for this service. */
@Entity
@Table(name = "profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Profile {

  public static final String UNKNOWN_USER = "Unknown User";

  @Id private UUID id;

  @Column(nullable = false)
  private String fullName;

  private String displayName;

  /** Display name, falling back to the full name, then to "Unknown User". */
  public String resolveName() {
    if (displayName != null && !displayName.isBlank()) {
      return displayName;
    }
    if (fullName != null && !fullName.isBlank()) {
      return fullName;
    }
    return UNKNOWN_USER;
  }

  /** Null-safe variant of {@link #resolveName()}. */
  public static String nameOf(Profile profile) {
    return profile != null ? profile.resolveName() : UNKNOWN_USER;
  }
}
