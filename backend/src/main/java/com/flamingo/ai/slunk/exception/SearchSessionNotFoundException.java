package com.flamingo.ai.slunk.exception;

import java.util.UUID;

/** Exception thrown when a conversational search session is unknown or expired. */
public class SearchSessionNotFoundException extends RuntimeException {

  private final UUID sessionId;

  public SearchSessionNotFoundException(UUID sessionId) {
    super("Search session not found: " + sessionId);
    this.sessionId = sessionId;
  }

  public UUID getSessionId() {
    return sessionId;
  }
}
