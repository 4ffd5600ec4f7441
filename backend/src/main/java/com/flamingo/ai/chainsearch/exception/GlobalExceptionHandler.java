package com.flamingo.ai.chainsearch.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MessageNotFoundException.class)
  public ResponseEntity<ApiError> handleMessageNotFound(
      MessageNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("message_not_found");
    String errorId = generateErrorId();
    log.warn("Message not found [{}]: {}", errorId, ex.getMessageId());
    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.MESSAGE_NOT_FOUND, "Message not found", request);
  }

  @ExceptionHandler(AttachmentNotFoundException.class)
  public ResponseEntity<ApiError> handleAttachmentNotFound(
      AttachmentNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("attachment_not_found");
    String errorId = generateErrorId();
    log.warn("Attachment not found [{}]: {}", errorId, ex.getAttachmentId());
    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.ATTACHMENT_NOT_FOUND,
        "Attachment not found",
        request);
  }

  @ExceptionHandler(ChatContextNotFoundException.class)
  public ResponseEntity<ApiError> handleChatContextNotFound(
      ChatContextNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("chat_context_not_found");
    String errorId = generateErrorId();
    log.warn("Chat context not found [{}]: {}", errorId, ex.getChatContext().key());
    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.CHAT_CONTEXT_NOT_FOUND,
        ex.getChatContext().isChannel() ? "Channel not found" : "Conversation not found",
        request);
  }

  @ExceptionHandler(ProfileNotFoundException.class)
  public ResponseEntity<ApiError> handleProfileNotFound(
      ProfileNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("profile_not_found");
    String errorId = generateErrorId();
    log.warn("Profile not found [{}]: {}", errorId, ex.getProfileId());
    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.PROFILE_NOT_FOUND, "Author not found", request);
  }

  @ExceptionHandler(InvalidMessageException.class)
  public ResponseEntity<ApiError> handleInvalidMessage(
      InvalidMessageException ex, HttpServletRequest request) {
    incrementErrorCounter("invalid_message");
    String errorId = generateErrorId();
    log.warn("Invalid message [{}]: {}", errorId, ex.getMessage());
    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_MESSAGE, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
