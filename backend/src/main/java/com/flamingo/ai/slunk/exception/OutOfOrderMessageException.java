package com.flamingo.ai.slunk.exception;

import java.time.Instant;

/** Exception thrown when a new message is older than the latest accepted one in its scope. */
public class OutOfOrderMessageException extends RuntimeException {

  private final String scope;
  private final Instant timestamp;
  private final Instant watermark;

  public OutOfOrderMessageException(String scope, Instant timestamp, Instant watermark) {
    super(
        "Message at "
            + timestamp
            + " is older than latest accepted message at "
            + watermark
            + " in "
            + scope);
    this.scope = scope;
    this.timestamp = timestamp;
    this.watermark = watermark;
  }

  public String getScope() {
    return scope;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public Instant getWatermark() {
    return watermark;
  }
}
