package com.flamingo.ai.slunk.exception;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain exceptions to structured {@link ApiError} responses. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidMessageException.class)
  public ResponseEntity<ApiError> handleInvalidMessage(
      InvalidMessageException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_message");
    String errorId = generateErrorId();
    log.warn("Invalid message [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_MESSAGE, ex.getMessage(), request);
  }

  @ExceptionHandler(OutOfOrderMessageException.class)
  public ResponseEntity<ApiError> handleOutOfOrder(
      OutOfOrderMessageException ex, HttpServletRequest request) {

    incrementErrorCounter("out_of_order");
    String errorId = generateErrorId();
    log.warn(
        "Out-of-order message [{}]: scope={}, timestamp={}, watermark={}",
        errorId,
        ex.getScope(),
        ex.getTimestamp(),
        ex.getWatermark());

    return respond(HttpStatus.CONFLICT, errorId, ApiError.OUT_OF_ORDER, ex.getMessage(), request);
  }

  @ExceptionHandler(MessageNotFoundException.class)
  public ResponseEntity<ApiError> handleMessageNotFound(
      MessageNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("message_not_found");
    String errorId = generateErrorId();
    log.warn("Message not found [{}]: {}", errorId, ex.getMessageId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.MESSAGE_NOT_FOUND, "Message not found", request);
  }

  @ExceptionHandler(ThreadNotFoundException.class)
  public ResponseEntity<ApiError> handleThreadNotFound(
      ThreadNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("thread_not_found");
    String errorId = generateErrorId();
    log.warn("Thread not found [{}]: {}", errorId, ex.getThreadId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.THREAD_NOT_FOUND, "Thread not found", request);
  }

  @ExceptionHandler(SearchSessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSearchSessionNotFound(
      SearchSessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("search_session_not_found");
    String errorId = generateErrorId();
    log.warn("Search session not found [{}]: {}", errorId, ex.getSessionId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SEARCH_SESSION_NOT_FOUND,
        "Search session not found or expired",
        request);
  }

  @ExceptionHandler(EmbeddingGenerationException.class)
  public ResponseEntity<ApiError> handleEmbeddingGeneration(
      EmbeddingGenerationException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_failed");
    String errorId = generateErrorId();
    log.error("Embedding generation error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.EMBEDDING_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiError> handleStoreUnavailable(
      StoreUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("store_unavailable");
    String errorId = generateErrorId();
    log.error("Store unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORE_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiError> handleCircuitOpen(
      CallNotPermittedException ex, HttpServletRequest request) {

    incrementErrorCounter("circuit_open");
    String errorId = generateErrorId();
    log.warn("Circuit breaker open [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORE_UNAVAILABLE,
        "The search index is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(QueryTimeoutException.class)
  public ResponseEntity<ApiError> handleQueryTimeout(
      QueryTimeoutException ex, HttpServletRequest request) {

    incrementErrorCounter("query_timeout");
    String errorId = generateErrorId();
    log.warn("Query timeout [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.GATEWAY_TIMEOUT,
        errorId,
        ApiError.QUERY_TIMEOUT,
        "The request took too long. Please retry.",
        request);
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

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        "Request body is malformed",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
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
