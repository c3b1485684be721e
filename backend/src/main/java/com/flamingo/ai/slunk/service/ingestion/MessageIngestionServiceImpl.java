package com.flamingo.ai.slunk.service.ingestion;

import com.flamingo.ai.slunk.api.dto.response.IngestionStats;
import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;
import com.flamingo.ai.slunk.exception.InvalidMessageException;
import com.flamingo.ai.slunk.exception.OutOfOrderMessageException;
import com.flamingo.ai.slunk.service.context.ConversationChunk;
import com.flamingo.ai.slunk.service.context.MessageContextualizer;
import com.flamingo.ai.slunk.service.context.ThreadContextService;
import com.flamingo.ai.slunk.service.dedup.DeduplicationResult;
import com.flamingo.ai.slunk.service.dedup.MessageDeduplicator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/** Implementation of MessageIngestionService. */
@Service
@Slf4j
public class MessageIngestionServiceImpl implements MessageIngestionService {

  private final MessageDeduplicator deduplicator;
  private final MessageIndexer messageIndexer;
  private final MessageContextualizer contextualizer;
  private final ThreadContextService threadContextService;
  private final ThreadPoolTaskExecutor ingestionExecutor;
  private final SlunkConfig slunkConfig;
  private final MeterRegistry meterRegistry;

  public MessageIngestionServiceImpl(
      MessageDeduplicator deduplicator,
      MessageIndexer messageIndexer,
      MessageContextualizer contextualizer,
      ThreadContextService threadContextService,
      @Qualifier("ingestionExecutor") ThreadPoolTaskExecutor ingestionExecutor,
      SlunkConfig slunkConfig,
      MeterRegistry meterRegistry) {
    this.deduplicator = deduplicator;
    this.messageIndexer = messageIndexer;
    this.contextualizer = contextualizer;
    this.threadContextService = threadContextService;
    this.ingestionExecutor = ingestionExecutor;
    this.slunkConfig = slunkConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "ingestion.single", description = "Time to ingest one message")
  public DeduplicationResult ingest(Message message) {
    validate(message);
    DeduplicationResult result = deduplicator.process(message);
    recordOutcome(result.outcome());
    invalidateThread(result.message());

    switch (result.outcome()) {
      case NEW, UPDATED, REACTIONS_UPDATED -> indexAndMark(result.message());
      case DUPLICATE -> {
        if (!result.message().isIndexed()) {
          log.info("Re-indexing duplicate message {} missing from the index", result.messageId());
          indexAndMark(result.message());
        }
      }
    }
    return result;
  }

  @Override
  @Timed(value = "ingestion.batch", description = "Time to ingest a batch of messages")
  public IngestionStats ingestBatch(List<Message> messages) {
    log.info("Ingesting batch of {} messages", messages.size());
    Map<DeduplicationOutcome, Integer> outcomes = new EnumMap<>(DeduplicationOutcome.class);
    int rejected = 0;

    List<Message> valid = new ArrayList<>();
    for (Message message : messages) {
      try {
        validate(message);
        valid.add(message);
      } catch (InvalidMessageException e) {
        rejected++;
        log.warn("Rejected message in batch: {}", e.getMessage());
      }
    }
    valid.sort(Comparator.comparing(Message::getTimestamp));

    // One snapshot per message id: a batch may carry a message together with its edits.
    Map<String, Message> toIndex = new LinkedHashMap<>();
    Set<String> changedIds = new LinkedHashSet<>();
    Set<String> touchedThreads = new LinkedHashSet<>();
    for (Message message : valid) {
      DeduplicationResult result;
      try {
        result = deduplicator.process(message);
      } catch (OutOfOrderMessageException | InvalidMessageException e) {
        rejected++;
        log.warn("Rejected message in batch: {}", e.getMessage());
        continue;
      }
      outcomes.merge(result.outcome(), 1, Integer::sum);
      recordOutcome(result.outcome());
      Message stored = result.message();
      touchedThreads.add(stored.getId());
      if (stored.isInThread()) {
        touchedThreads.add(stored.getThreadId());
      }
      if (result.outcome().requiresIndexing()) {
        toIndex.merge(stored.getId(), stored, MessageIngestionServiceImpl::latest);
        changedIds.add(stored.getId());
      } else if (result.outcome() == DeduplicationOutcome.REACTIONS_UPDATED
          || !stored.isIndexed()) {
        toIndex.merge(stored.getId(), stored, MessageIngestionServiceImpl::latest);
      }
    }
    touchedThreads.forEach(threadContextService::invalidate);
    List<Message> changed =
        toIndex.values().stream().filter(m -> changedIds.contains(m.getId())).toList();

    AtomicInteger indexed = new AtomicInteger();
    AtomicInteger failures = new AtomicInteger();
    List<CompletableFuture<Void>> futures =
        toIndex.values().stream()
            .map(
                message ->
                    CompletableFuture.runAsync(
                        () -> {
                          try {
                            indexAndMark(message);
                            indexed.incrementAndGet();
                          } catch (RuntimeException e) {
                            failures.incrementAndGet();
                            log.error(
                                "Failed to index message {}: {}", message.getId(), e.getMessage());
                          }
                        },
                        ingestionExecutor))
            .toList();
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    int chunksIndexed = 0;
    if (slunkConfig.getIngestion().isIndexChunks() && !changed.isEmpty()) {
      chunksIndexed = indexChunks(changed);
    }

    IngestionStats stats =
        IngestionStats.builder()
            .received(messages.size())
            .newMessages(outcomes.getOrDefault(DeduplicationOutcome.NEW, 0))
            .duplicates(outcomes.getOrDefault(DeduplicationOutcome.DUPLICATE, 0))
            .updated(outcomes.getOrDefault(DeduplicationOutcome.UPDATED, 0))
            .reactionsUpdated(outcomes.getOrDefault(DeduplicationOutcome.REACTIONS_UPDATED, 0))
            .rejected(rejected)
            .indexed(indexed.get())
            .indexFailures(failures.get())
            .chunksIndexed(chunksIndexed)
            .build();
    log.info("Batch ingested: {}", stats);
    return stats;
  }

  /** Keeps the newer of two stored snapshots of the same message; ties go to the later one. */
  static Message latest(Message earlier, Message later) {
    return later.getVersion() >= earlier.getVersion() ? later : earlier;
  }

  /** Chunks are built per channel so a chunk never mixes conversations. */
  private int indexChunks(List<Message> messages) {
    Map<String, List<Message>> byChannel = new LinkedHashMap<>();
    for (Message message : messages) {
      byChannel.computeIfAbsent(message.getChannel(), c -> new ArrayList<>()).add(message);
    }
    List<ConversationChunk> chunks = new ArrayList<>();
    for (List<Message> group : byChannel.values()) {
      chunks.addAll(contextualizer.createConversationChunks(group));
    }
    try {
      return messageIndexer.indexChunks(chunks);
    } catch (RuntimeException e) {
      log.error("Failed to index {} conversation chunks: {}", chunks.size(), e.getMessage());
      return 0;
    }
  }

  private void indexAndMark(Message message) {
    // An indexed message only needs its reactions copied over.
    if (message.isIndexed() && messageIndexer.refreshReactions(message)) {
      return;
    }
    messageIndexer.index(message);
    deduplicator.markIndexed(message.getId(), message.getVersion());
    message.setIndexed(true);
  }

  private void invalidateThread(Message message) {
    threadContextService.invalidate(message.getId());
    if (message.isInThread()) {
      threadContextService.invalidate(message.getThreadId());
    }
  }

  private void recordOutcome(DeduplicationOutcome outcome) {
    meterRegistry.counter("ingestion.outcome", "outcome", outcome.name().toLowerCase()).increment();
  }

  /** Checks required fields and normalizes the channel name. */
  static void validate(Message message) {
    if (message == null) {
      throw new InvalidMessageException("message");
    }
    if (message.getSender() == null || message.getSender().isBlank()) {
      throw new InvalidMessageException("sender");
    }
    if (message.getContent() == null || message.getContent().isBlank()) {
      throw new InvalidMessageException("content");
    }
    if (message.getChannel() == null || message.getChannel().isBlank()) {
      throw new InvalidMessageException("channel");
    }
    if (message.getTimestamp() == null) {
      throw new InvalidMessageException("timestamp");
    }
    String channel = message.getChannel().trim();
    message.setChannel(channel.startsWith("#") ? channel.substring(1) : channel);
    message.setSender(message.getSender().trim());
    if (message.getThreadId() != null && message.getThreadId().isBlank()) {
      message.setThreadId(null);
    }
  }
}
