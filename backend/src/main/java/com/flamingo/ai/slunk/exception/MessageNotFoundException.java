package com.flamingo.ai.slunk.exception;

/** Exception thrown when a message is not found. */
public class MessageNotFoundException extends RuntimeException {

  private final String messageId;

  public MessageNotFoundException(String messageId) {
    super("Message not found: " + messageId);
    this.messageId = messageId;
  }

  public String getMessageId() {
    return messageId;
  }
}
