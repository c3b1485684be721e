package com.flamingo.ai.slunk.service.dedup;

import com.flamingo.ai.slunk.domain.entity.DeduplicationRecord;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;
import com.flamingo.ai.slunk.domain.repository.DeduplicationRecordRepository;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import com.flamingo.ai.slunk.exception.InvalidMessageException;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Classifies incoming messages against the last stored state of their identity and applies the
 * resulting change.
 *
 * <p>Each dedup key is guarded by a striped lock held across the whole transaction, so two callers
 * racing on the same message observe NEW and DUPLICATE rather than both inserting.
 */
@Service
@Slf4j
public class MessageDeduplicator {

  private static final int LOCK_STRIPES = 256;

  private final MessageRepository messageRepository;
  private final DeduplicationRecordRepository deduplicationRecordRepository;
  private final DeduplicationKeyPolicy keyPolicy;
  private final MessageOrderingGuard orderingGuard;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

  public MessageDeduplicator(
      MessageRepository messageRepository,
      DeduplicationRecordRepository deduplicationRecordRepository,
      DeduplicationKeyPolicy keyPolicy,
      MessageOrderingGuard orderingGuard,
      PlatformTransactionManager transactionManager,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.messageRepository = messageRepository;
    this.deduplicationRecordRepository = deduplicationRecordRepository;
    this.keyPolicy = keyPolicy;
    this.orderingGuard = orderingGuard;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Classifies and stores a validated message.
   *
   * @param incoming message with sender, content, channel and timestamp set
   * @return the outcome together with the stored state
   * @throws InvalidMessageException when a caller id is already bound to another identity
   * @throws com.flamingo.ai.slunk.exception.OutOfOrderMessageException when a new message
   *     predates its channel or thread
   */
  public DeduplicationResult process(Message incoming) {
    keyPolicy.assignIdentity(incoming);
    String key = incoming.getDedupKey();
    Lock lock = locks.get(key);
    lock.lock();
    try {
      DeduplicationResult result = transactionTemplate.execute(status -> classify(incoming));
      if (result.outcome() == DeduplicationOutcome.NEW) {
        orderingGuard.advance(result.message());
      }
      meterRegistry
          .counter("dedup.outcome", "outcome", result.outcome().name().toLowerCase())
          .increment();
      log.debug("Message {} classified as {}", result.messageId(), result.outcome());
      return result;
    } finally {
      lock.unlock();
    }
  }

  /** Marks the current version of a message as present in the search index. */
  public void markIndexed(String messageId, int version) {
    transactionTemplate.executeWithoutResult(
        status ->
            messageRepository
                .findById(messageId)
                .filter(m -> m.getVersion() == version && !m.isIndexed())
                .ifPresent(
                    m -> {
                      m.setIndexed(true);
                      messageRepository.save(m);
                    }));
  }

  private DeduplicationResult classify(Message incoming) {
    Optional<DeduplicationRecord> existing =
        deduplicationRecordRepository.findById(incoming.getDedupKey());
    if (existing.isEmpty()) {
      return insert(incoming);
    }
    DeduplicationRecord record = existing.get();
    Message stored =
        messageRepository
            .findById(record.getMessageId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Deduplication record without message: " + record.getMessageId()));

    if (!record.getContentHash().equals(incoming.getContentHash())) {
      return update(record, stored, incoming);
    }
    if (reactionsChanged(record.getLastReactions(), incoming.getReactions())) {
      return updateReactions(record, stored, incoming);
    }
    return DeduplicationResult.of(DeduplicationOutcome.DUPLICATE, stored);
  }

  private DeduplicationResult insert(Message incoming) {
    Optional<Message> clash = messageRepository.findById(incoming.getId());
    if (clash.isPresent()) {
      throw new InvalidMessageException(
          "id", "Message id " + incoming.getId() + " is already used by another message");
    }
    orderingGuard.check(incoming);

    incoming.setVersion(1);
    incoming.setIndexed(false);
    Message saved = messageRepository.save(incoming);
    deduplicationRecordRepository.save(
        DeduplicationRecord.builder()
            .dedupKey(saved.getDedupKey())
            .messageId(saved.getId())
            .contentHash(saved.getContentHash())
            .version(1)
            .lastReactions(copyOf(saved.getReactions()))
            .updatedAt(clock.instant())
            .build());
    return DeduplicationResult.of(DeduplicationOutcome.NEW, saved);
  }

  private DeduplicationResult update(
      DeduplicationRecord record, Message stored, Message incoming) {
    Instant editedAt = incoming.getEditedAt() != null ? incoming.getEditedAt() : clock.instant();
    int version = record.getVersion() + 1;

    stored.setContent(incoming.getContent());
    stored.setSender(incoming.getSender());
    stored.setTimestamp(incoming.getTimestamp());
    stored.setContentHash(incoming.getContentHash());
    stored.setEditedAt(editedAt);
    stored.setVersion(version);
    stored.setIndexed(false);
    if (incoming.getReactions() != null) {
      stored.setReactions(copyOf(incoming.getReactions()));
      record.setLastReactions(copyOf(incoming.getReactions()));
    }
    if (incoming.getMentions() != null) {
      stored.setMentions(incoming.getMentions());
    }
    if (incoming.getAttachmentNames() != null) {
      stored.setAttachmentNames(incoming.getAttachmentNames());
    }
    Message saved = messageRepository.save(stored);

    record.setContentHash(incoming.getContentHash());
    record.setVersion(version);
    record.setUpdatedAt(clock.instant());
    deduplicationRecordRepository.save(record);
    log.info("Message {} edited, now version {}", saved.getId(), version);
    return DeduplicationResult.of(DeduplicationOutcome.UPDATED, saved);
  }

  private DeduplicationResult updateReactions(
      DeduplicationRecord record, Message stored, Message incoming) {
    stored.setReactions(copyOf(incoming.getReactions()));
    Message saved = messageRepository.save(stored);

    record.setLastReactions(copyOf(incoming.getReactions()));
    record.setUpdatedAt(clock.instant());
    deduplicationRecordRepository.save(record);
    return DeduplicationResult.of(DeduplicationOutcome.REACTIONS_UPDATED, saved);
  }

  /** Null incoming reactions were not captured and never count as a change. */
  static boolean reactionsChanged(Map<String, Integer> stored, Map<String, Integer> incoming) {
    if (incoming == null) {
      return false;
    }
    Map<String, Integer> previous = stored == null ? Collections.emptyMap() : stored;
    return !Objects.equals(previous, incoming);
  }

  private static Map<String, Integer> copyOf(Map<String, Integer> reactions) {
    return reactions == null ? null : new HashMap<>(reactions);
  }
}
