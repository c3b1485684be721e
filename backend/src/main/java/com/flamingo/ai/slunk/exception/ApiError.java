package com.flamingo.ai.slunk.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String INVALID_MESSAGE = "MESSAGE_001";
  public static final String MESSAGE_NOT_FOUND = "MESSAGE_002";
  public static final String OUT_OF_ORDER = "MESSAGE_003";
  public static final String THREAD_NOT_FOUND = "THREAD_001";
  public static final String EMBEDDING_FAILED = "EMBEDDING_001";
  public static final String STORE_UNAVAILABLE = "SEARCH_001";
  public static final String QUERY_TIMEOUT = "SEARCH_002";
  public static final String SEARCH_SESSION_NOT_FOUND = "SEARCH_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
