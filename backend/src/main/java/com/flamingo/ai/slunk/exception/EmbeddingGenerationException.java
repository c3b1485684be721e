package com.flamingo.ai.slunk.exception;

/** Exception thrown when an embedding cannot be produced for a text. Never retried. */
public class EmbeddingGenerationException extends RuntimeException {

  private final String userMessage;

  public EmbeddingGenerationException(String message) {
    super(message);
    this.userMessage = "Could not generate an embedding for the given text";
  }

  public EmbeddingGenerationException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Could not generate an embedding for the given text";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
