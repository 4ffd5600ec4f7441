package com.flamingo.ai.chainsearch.exception;

import java.util.UUID;

/** Exception thrown when a message author does not exist. */
public class ProfileNotFoundException extends RuntimeException {

  private final UUID profileId;

  public ProfileNotFoundException(UUID profileId) {
    super("Profile not found: " + profileId);
    this.profileId = profileId;
  }

  public UUID getProfileId() {
    return profileId;
  }
}
