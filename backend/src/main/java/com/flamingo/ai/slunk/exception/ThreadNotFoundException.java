package com.flamingo.ai.slunk.exception;

/** Exception thrown when a thread has no stored messages. */
public class ThreadNotFoundException extends RuntimeException {

  private final String threadId;

  public ThreadNotFoundException(String threadId) {
    super("Thread not found: " + threadId);
    this.threadId = threadId;
  }

  public String getThreadId() {
    return threadId;
  }
}
