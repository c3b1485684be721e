package com.flamingo.ai.slunk.service.dedup;

import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;

/**
 * Outcome of passing one message through the deduplication gate.
 *
 * @param outcome the classification
 * @param messageId id of the stored message
 * @param version stored version after the call
 * @param contentHash stored content hash after the call
 * @param message the stored message after the call
 */
public record DeduplicationResult(
    DeduplicationOutcome outcome,
    String messageId,
    int version,
    String contentHash,
    Message message) {

  static DeduplicationResult of(DeduplicationOutcome outcome, Message stored) {
    return new DeduplicationResult(
        outcome, stored.getId(), stored.getVersion(), stored.getContentHash(), stored);
  }
}
