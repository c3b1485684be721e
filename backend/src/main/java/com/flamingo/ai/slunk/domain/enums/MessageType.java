package com.flamingo.ai.slunk.domain.enums;

/** Kind of chat message as captured from the source. */
public enum MessageType {
  /** Top-level channel message. */
  REGULAR,

  /** Message that started a thread. */
  THREAD,

  /** Reply inside a thread. */
  REPLY,

  /** Join/leave and other system notices. */
  SYSTEM,

  BOT
}
