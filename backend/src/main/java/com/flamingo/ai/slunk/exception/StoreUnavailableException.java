package com.flamingo.ai.slunk.exception;

/** Exception thrown when the message index cannot be read or written. */
public class StoreUnavailableException extends RuntimeException {

  private final String userMessage;

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "The search index is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
