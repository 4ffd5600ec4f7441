package com.flamingo.ai.chainsearch.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  public static final String MESSAGE_NOT_FOUND = "MESSAGE_001";
  public static final String INVALID_MESSAGE = "MESSAGE_002";
  public static final String ATTACHMENT_NOT_FOUND = "ATTACHMENT_001";
  public static final String CHAT_CONTEXT_NOT_FOUND = "CONTEXT_001";
  public static final String PROFILE_NOT_FOUND = "PROFILE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
