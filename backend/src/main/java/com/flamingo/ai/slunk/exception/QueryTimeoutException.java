package com.flamingo.ai.slunk.exception;

import java.time.Duration;

/** Exception thrown when an embedding, store or search call exceeds its deadline. */
public class QueryTimeoutException extends RuntimeException {

  private final String operation;
  private final Duration timeout;

  public QueryTimeoutException(String operation, Duration timeout, Throwable cause) {
    super(operation + " timed out after " + timeout.toMillis() + " ms", cause);
    this.operation = operation;
    this.timeout = timeout;
  }

  public String getOperation() {
    return operation;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
