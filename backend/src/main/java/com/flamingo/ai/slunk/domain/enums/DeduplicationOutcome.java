package com.flamingo.ai.slunk.domain.enums;

/** Classification of an incoming message by the deduplication gate. */
public enum DeduplicationOutcome {
  /** First time this identity is seen; stored with version 1. */
  NEW,

  /** Same content and reactions as the stored record; nothing changes. */
  DUPLICATE,

  /** Content changed; version bumped and edit time recorded. */
  UPDATED,

  /** Content unchanged but reactions differ; only reactions are replaced. */
  REACTIONS_UPDATED;

  /** Whether the message text must be re-embedded and re-indexed. */
  public boolean requiresIndexing() {
    return this == NEW || this == UPDATED;
  }
}
