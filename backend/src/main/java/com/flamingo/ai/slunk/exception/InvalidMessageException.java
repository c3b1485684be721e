package com.flamingo.ai.slunk.exception;

/** Exception thrown when an incoming message is missing a required field or is malformed. */
public class InvalidMessageException extends RuntimeException {

  private final String field;

  public InvalidMessageException(String field) {
    this(field, "Message field is required: " + field);
  }

  public InvalidMessageException(String field, String message) {
    super(message);
    this.field = field;
  }

  public String getField() {
    return field;
  }
}
