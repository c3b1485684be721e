package com.flamingo.ai.slunk.service.ingestion;

import static com.flamingo.ai.slunk.support.TestMessages.message;
import static com.flamingo.ai.slunk.support.TestMessages.reply;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.slunk.api.dto.response.IngestionStats;
import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;
import com.flamingo.ai.slunk.exception.InvalidMessageException;
import com.flamingo.ai.slunk.exception.OutOfOrderMessageException;
import com.flamingo.ai.slunk.exception.StoreUnavailableException;
import com.flamingo.ai.slunk.service.context.ConversationChunk;
import com.flamingo.ai.slunk.service.context.MessageContextualizer;
import com.flamingo.ai.slunk.service.context.ThreadContextService;
import com.flamingo.ai.slunk.service.dedup.DeduplicationResult;
import com.flamingo.ai.slunk.service.dedup.MessageDeduplicator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MessageIngestionServiceImplTest {

  private static final Instant T0 = Instant.parse("2024-03-15T10:00:00Z");

  @Mock private MessageDeduplicator deduplicator;
  @Mock private MessageIndexer messageIndexer;
  @Mock private MessageContextualizer contextualizer;
  @Mock private ThreadContextService threadContextService;

  /** Outcome the mocked deduplicator reports, keyed by message id. */
  private final Map<String, DeduplicationOutcome> outcomes = new ConcurrentHashMap<>();

  private SlunkConfig slunkConfig;
  private SimpleMeterRegistry meterRegistry;
  private ThreadPoolTaskExecutor ingestionExecutor;
  private MessageIngestionServiceImpl ingestionService;

  @BeforeEach
  void setUp() {
    slunkConfig = new SlunkConfig();
    meterRegistry = new SimpleMeterRegistry();
    ingestionExecutor = new ThreadPoolTaskExecutor();
    ingestionExecutor.setCorePoolSize(2);
    ingestionExecutor.initialize();
    ingestionService =
        new MessageIngestionServiceImpl(
            deduplicator,
            messageIndexer,
            contextualizer,
            threadContextService,
            ingestionExecutor,
            slunkConfig,
            meterRegistry);

    when(deduplicator.process(any(Message.class)))
        .thenAnswer(
            inv -> {
              Message m = inv.getArgument(0);
              DeduplicationOutcome outcome =
                  outcomes.getOrDefault(m.getId(), DeduplicationOutcome.NEW);
              return new DeduplicationResult(outcome, m.getId(), m.getVersion(), "hash", m);
            });
  }

  @AfterEach
  void tearDown() {
    ingestionExecutor.shutdown();
  }

  @Nested
  @DisplayName("ingest")
  class Ingest {

    @Test
    @DisplayName("should index a new message and mark it indexed")
    void shouldIndexNewMessage() {
      Message incoming = reply("m1", "t1", "alice", "Rolling out the new gateway", T0);

      DeduplicationResult result = ingestionService.ingest(incoming);

      assertThat(result.outcome()).isEqualTo(DeduplicationOutcome.NEW);
      verify(messageIndexer).index(incoming);
      verify(deduplicator).markIndexed("m1", 1);
      verify(threadContextService).invalidate("t1");
      assertThat(incoming.isIndexed()).isTrue();
      assertThat(meterRegistry.counter("ingestion.outcome", "outcome", "new").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should skip indexing for a duplicate already in the index")
    void shouldSkipIndexedDuplicate() {
      Message incoming = message("m1", "alice", "hello", T0);
      incoming.setIndexed(true);
      outcomes.put("m1", DeduplicationOutcome.DUPLICATE);

      ingestionService.ingest(incoming);

      verify(messageIndexer, never()).index(any());
      verify(messageIndexer, never()).refreshReactions(any());
    }

    @Test
    @DisplayName("should re-index a duplicate whose earlier index write failed")
    void shouldRepairUnindexedDuplicate() {
      Message incoming = message("m1", "alice", "hello", T0);
      outcomes.put("m1", DeduplicationOutcome.DUPLICATE);

      ingestionService.ingest(incoming);

      verify(messageIndexer).index(incoming);
    }

    @Test
    @DisplayName("should only copy reactions for an indexed message")
    void shouldRefreshReactionsOnly() {
      Message incoming = message("m1", "alice", "ship it", T0);
      incoming.setIndexed(true);
      outcomes.put("m1", DeduplicationOutcome.REACTIONS_UPDATED);
      when(messageIndexer.refreshReactions(incoming)).thenReturn(true);

      ingestionService.ingest(incoming);

      verify(messageIndexer).refreshReactions(incoming);
      verify(messageIndexer, never()).index(any());
    }

    @Test
    @DisplayName("should reject a message without content before deduplication")
    void shouldRejectInvalidMessage() {
      Message incoming = message("m1", "alice", "  ", T0);

      assertThatThrownBy(() -> ingestionService.ingest(incoming))
          .isInstanceOf(InvalidMessageException.class)
          .extracting("field")
          .isEqualTo("content");
      verify(deduplicator, never()).process(any());
    }

    @Test
    @DisplayName("should normalize channel, sender and thread id")
    void shouldNormalizeFields() {
      Message incoming = message("m1", " alice ", "hello", T0);
      incoming.setChannel(" #general ");
      incoming.setThreadId("  ");

      MessageIngestionServiceImpl.validate(incoming);

      assertThat(incoming.getChannel()).isEqualTo("general");
      assertThat(incoming.getSender()).isEqualTo("alice");
      assertThat(incoming.getThreadId()).isNull();
    }
  }

  @Nested
  @DisplayName("ingestBatch")
  class IngestBatch {

    @Test
    @DisplayName("should count every outcome and keep going past bad messages")
    void shouldSummarizeBatch() {
      Message fresh = message("m1", "alice", "deploy started", T0);
      Message duplicate = message("m2", "bob", "deploy approved", T0.plusSeconds(10));
      duplicate.setIndexed(true);
      outcomes.put("m2", DeduplicationOutcome.DUPLICATE);
      Message edited = message("m3", "carol", "deploy finished (edited)", T0.plusSeconds(20));
      outcomes.put("m3", DeduplicationOutcome.UPDATED);
      Message late = message("m4", "dave", "late message", T0.minusSeconds(3600));
      when(deduplicator.process(late))
          .thenThrow(new OutOfOrderMessageException("engineering", T0.minusSeconds(3600), T0));
      Message invalid = message("m5", "", "no sender", T0);
      ConversationChunk chunk = chunkOf(fresh, edited);
      when(contextualizer.createConversationChunks(anyList())).thenReturn(List.of(chunk));
      when(messageIndexer.indexChunks(List.of(chunk))).thenReturn(1);

      IngestionStats stats =
          ingestionService.ingestBatch(List.of(fresh, duplicate, edited, late, invalid));

      assertThat(stats.getReceived()).isEqualTo(5);
      assertThat(stats.getNewMessages()).isEqualTo(1);
      assertThat(stats.getDuplicates()).isEqualTo(1);
      assertThat(stats.getUpdated()).isEqualTo(1);
      assertThat(stats.getRejected()).isEqualTo(2);
      assertThat(stats.getIndexed()).isEqualTo(2);
      assertThat(stats.getIndexFailures()).isZero();
      assertThat(stats.getChunksIndexed()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("should index and chunk only the latest snapshot of a message edited in a batch")
    void shouldCollapseSnapshotsOfOneMessage() {
      Message original = message("m1", "alice", "restart the cache", T0);
      Message edit = message("m1", "alice", "restart the cache cluster", T0);
      edit.setVersion(2);
      when(deduplicator.process(edit))
          .thenReturn(
              new DeduplicationResult(DeduplicationOutcome.UPDATED, "m1", 2, "hash2", edit));
      when(messageIndexer.indexChunks(anyList())).thenReturn(1);

      IngestionStats stats = ingestionService.ingestBatch(List.of(original, edit));

      assertThat(stats.getNewMessages()).isEqualTo(1);
      assertThat(stats.getUpdated()).isEqualTo(1);
      assertThat(stats.getIndexed()).isEqualTo(1);
      verify(messageIndexer).index(edit);
      verify(messageIndexer, never()).index(original);
      verify(deduplicator).markIndexed("m1", 2);
      ArgumentCaptor<List<Message>> chunked = ArgumentCaptor.forClass(List.class);
      verify(contextualizer).createConversationChunks(chunked.capture());
      assertThat(chunked.getValue()).containsExactly(edit);
    }

    @Test
    @DisplayName("should keep the higher version when snapshots arrive out of order")
    void shouldPreferHigherVersion() {
      Message v1 = message("m1", "alice", "one", T0);
      Message v2 = message("m1", "alice", "two", T0);
      v2.setVersion(2);
      Message sameVersion = message("m1", "alice", "two", T0);
      sameVersion.setVersion(2);

      assertThat(MessageIngestionServiceImpl.latest(v2, v1)).isSameAs(v2);
      assertThat(MessageIngestionServiceImpl.latest(v1, v2)).isSameAs(v2);
      assertThat(MessageIngestionServiceImpl.latest(v2, sameVersion)).isSameAs(sameVersion);
    }

    @Test
    @DisplayName("should deduplicate in timestamp order")
    void shouldProcessInTimestampOrder() {
      Message second = message("b", "alice", "second", T0.plusSeconds(60));
      Message first = message("a", "alice", "first", T0);

      ingestionService.ingestBatch(List.of(second, first));

      InOrder order = inOrder(deduplicator);
      order.verify(deduplicator).process(first);
      order.verify(deduplicator).process(second);
    }

    @Test
    @DisplayName("should count index failures without failing the batch")
    void shouldCountIndexFailures() {
      Message ok = message("ok", "alice", "fine", T0);
      Message broken = message("broken", "alice", "store down", T0.plusSeconds(1));
      doThrow(new StoreUnavailableException("index", new RuntimeException("down")))
          .when(messageIndexer)
          .index(broken);
      slunkConfig.getIngestion().setIndexChunks(false);

      IngestionStats stats = ingestionService.ingestBatch(List.of(ok, broken));

      assertThat(stats.getIndexed()).isEqualTo(1);
      assertThat(stats.getIndexFailures()).isEqualTo(1);
      verify(deduplicator, never()).markIndexed("broken", 1);
      verify(contextualizer, never()).createConversationChunks(anyList());
    }

    @Test
    @DisplayName("should invalidate cached threads touched by the batch")
    void shouldInvalidateThreads() {
      ingestionService.ingestBatch(
          List.of(reply("r1", "t9", "alice", "first reply", T0), message("p", "bob", "hi", T0)));

      verify(threadContextService).invalidate("t9");
      verify(threadContextService).invalidate("p");
    }
  }

  private static ConversationChunk chunkOf(Message... members) {
    List<Message> messages = new ArrayList<>(List.of(members));
    return new ConversationChunk(
        "chunk-1",
        "deploy",
        messages,
        new ConversationChunk.TimeWindow(
            messages.get(0).getTimestamp(), messages.get(messages.size() - 1).getTimestamp()),
        List.of("alice", "carol"),
        "2 messages about deploy");
  }
}
