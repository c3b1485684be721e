package com.flamingo.ai.slunk.domain.enums;

/** Kind of document held in the message index. */
public enum DocumentKind {
  MESSAGE,
  CHUNK
}
