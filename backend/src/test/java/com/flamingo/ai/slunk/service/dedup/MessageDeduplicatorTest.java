package com.flamingo.ai.slunk.service.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.entity.DeduplicationRecord;
import com.flamingo.ai.slunk.domain.entity.Message;
import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;
import com.flamingo.ai.slunk.domain.repository.DeduplicationRecordRepository;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import com.flamingo.ai.slunk.exception.InvalidMessageException;
import com.flamingo.ai.slunk.exception.OutOfOrderMessageException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class MessageDeduplicatorTest {

  private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");
  private static final Instant SENT = Instant.parse("2024-03-15T09:30:00Z");

  @Mock private MessageRepository messageRepository;
  @Mock private DeduplicationRecordRepository deduplicationRecordRepository;
  @Mock private PlatformTransactionManager transactionManager;

  private final Map<String, Message> messages = new ConcurrentHashMap<>();
  private final Map<String, DeduplicationRecord> records = new ConcurrentHashMap<>();

  private SlunkConfig slunkConfig;
  private SimpleMeterRegistry meterRegistry;
  private MessageDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    when(messageRepository.findById(anyString()))
        .thenAnswer(inv -> Optional.ofNullable(messages.get(inv.<String>getArgument(0))));
    when(messageRepository.save(any(Message.class)))
        .thenAnswer(
            inv -> {
              Message m = inv.getArgument(0);
              messages.put(m.getId(), m);
              return m;
            });
    when(deduplicationRecordRepository.findById(anyString()))
        .thenAnswer(inv -> Optional.ofNullable(records.get(inv.<String>getArgument(0))));
    when(deduplicationRecordRepository.save(any(DeduplicationRecord.class)))
        .thenAnswer(
            inv -> {
              DeduplicationRecord r = inv.getArgument(0);
              records.put(r.getDedupKey(), r);
              return r;
            });

    slunkConfig = new SlunkConfig();
    meterRegistry = new SimpleMeterRegistry();
    deduplicator =
        new MessageDeduplicator(
            messageRepository,
            deduplicationRecordRepository,
            new DeduplicationKeyPolicy(),
            new MessageOrderingGuard(messageRepository, slunkConfig),
            transactionManager,
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static Message incoming(String content, Map<String, Integer> reactions) {
    return Message.builder()
        .sender("alice")
        .content(content)
        .channel("engineering")
        .timestamp(SENT)
        .reactions(reactions)
        .mentions(new ArrayList<>())
        .attachmentNames(new ArrayList<>())
        .build();
  }

  @Nested
  @DisplayName("classification")
  class Classification {

    @Test
    @DisplayName("should store a first sighting as version 1")
    void shouldStoreNewMessage() {
      DeduplicationResult result = deduplicator.process(incoming("Deploying 2.4 now", null));

      assertThat(result.outcome()).isEqualTo(DeduplicationOutcome.NEW);
      assertThat(result.version()).isEqualTo(1);
      assertThat(result.messageId()).isNotBlank();
      assertThat(result.message().isIndexed()).isFalse();
      assertThat(records).hasSize(1);
      assertThat(meterRegistry.counter("dedup.outcome", "outcome", "new").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should report a resend as a duplicate without writing")
    void shouldDetectDuplicate() {
      DeduplicationResult first = deduplicator.process(incoming("Deploying 2.4 now", null));
      DeduplicationResult second = deduplicator.process(incoming("Deploying 2.4 now", null));

      assertThat(second.outcome()).isEqualTo(DeduplicationOutcome.DUPLICATE);
      assertThat(second.messageId()).isEqualTo(first.messageId());
      assertThat(second.version()).isEqualTo(1);
      verify(messageRepository, times(1)).save(any(Message.class));
    }

    @Test
    @DisplayName("should bump the version when the content is edited")
    void shouldDetectEdit() {
      DeduplicationResult first = deduplicator.process(incoming("Deploying 2.4 now", null));
      String firstHash = first.contentHash();

      DeduplicationResult edited = deduplicator.process(incoming("Deploying 2.5 now", null));

      assertThat(edited.outcome()).isEqualTo(DeduplicationOutcome.UPDATED);
      assertThat(edited.messageId()).isEqualTo(first.messageId());
      assertThat(edited.version()).isEqualTo(2);
      assertThat(edited.contentHash()).isNotEqualTo(firstHash);
      assertThat(edited.message().getContent()).isEqualTo("Deploying 2.5 now");
      assertThat(edited.message().getEditedAt()).isEqualTo(NOW);
      assertThat(records.values().iterator().next().getVersion()).isEqualTo(2);
    }

    @Test
    @DisplayName("should replace only reactions when they change")
    void shouldDetectReactionChange() {
      DeduplicationResult first =
          deduplicator.process(incoming("Deploying 2.4 now", Map.of("👍", 1)));
      String firstHash = first.contentHash();

      DeduplicationResult reacted =
          deduplicator.process(incoming("Deploying 2.4 now", Map.of("👍", 2, "🎉", 1)));

      assertThat(reacted.outcome()).isEqualTo(DeduplicationOutcome.REACTIONS_UPDATED);
      assertThat(reacted.version()).isEqualTo(1);
      assertThat(reacted.contentHash()).isEqualTo(firstHash);
      assertThat(reacted.message().getReactions())
          .containsEntry("👍", 2)
          .containsEntry("🎉", 1);
    }

    @Test
    @DisplayName("should treat missing reactions as not captured")
    void shouldIgnoreMissingReactions() {
      deduplicator.process(incoming("Deploying 2.4 now", Map.of("👍", 1)));

      DeduplicationResult resent = deduplicator.process(incoming("Deploying 2.4 now", null));

      assertThat(resent.outcome()).isEqualTo(DeduplicationOutcome.DUPLICATE);
      assertThat(resent.message().getReactions()).containsEntry("👍", 1);
    }

    @Test
    @DisplayName("should compare reactions against an empty map when none were stored")
    void shouldCompareReactions() {
      assertThat(MessageDeduplicator.reactionsChanged(Map.of("👍", 1), null)).isFalse();
      assertThat(MessageDeduplicator.reactionsChanged(null, Map.of())).isFalse();
      assertThat(MessageDeduplicator.reactionsChanged(null, Map.of("👍", 1))).isTrue();
      assertThat(MessageDeduplicator.reactionsChanged(Map.of("👍", 1), Map.of("👍", 1)))
          .isFalse();
    }
  }

  @Nested
  @DisplayName("guards")
  class Guards {

    @Test
    @DisplayName("should reject a new message older than the channel watermark")
    void shouldRejectOutOfOrderMessage() {
      deduplicator.process(incoming("first", null));
      Message late = incoming("late arrival", null);
      late.setSender("bob");
      late.setTimestamp(SENT.minusSeconds(60));

      assertThatThrownBy(() -> deduplicator.process(late))
          .isInstanceOf(OutOfOrderMessageException.class)
          .hasMessageContaining("engineering");
      assertThat(records).hasSize(1);
    }

    @Test
    @DisplayName("should accept late messages when ordering is not enforced")
    void shouldAcceptLateMessageWhenOrderingDisabled() {
      slunkConfig.getIngestion().setEnforceOrdering(false);
      deduplicator.process(incoming("first", null));
      Message late = incoming("late arrival", null);
      late.setSender("bob");
      late.setTimestamp(SENT.minusSeconds(60));

      assertThat(deduplicator.process(late).outcome()).isEqualTo(DeduplicationOutcome.NEW);
    }

    @Test
    @DisplayName("should track ordering per thread rather than per channel")
    void shouldScopeOrderingToThreads() {
      deduplicator.process(incoming("channel message", null));
      Message earlierReply = incoming("reply in an older thread", null);
      earlierReply.setThreadId("t-old");
      earlierReply.setTimestamp(SENT.minusSeconds(3600));

      assertThat(deduplicator.process(earlierReply).outcome())
          .isEqualTo(DeduplicationOutcome.NEW);
    }

    @Test
    @DisplayName("should reject a caller id already bound to another message")
    void shouldRejectIdClash() {
      Message original = incoming("hello", null);
      original.setId("m-1");
      deduplicator.process(original);

      Message other = incoming("hello from elsewhere", null);
      other.setId("m-1");
      other.setChannel("random");

      assertThatThrownBy(() -> deduplicator.process(other))
          .isInstanceOf(InvalidMessageException.class)
          .extracting("field")
          .isEqualTo("id");
    }
  }

  @Test
  @DisplayName("should mark only the current version as indexed")
  void shouldMarkCurrentVersionIndexed() {
    DeduplicationResult result = deduplicator.process(incoming("Deploying 2.4 now", null));
    deduplicator.process(incoming("Deploying 2.5 now", null));

    deduplicator.markIndexed(result.messageId(), 1);
    assertThat(messages.get(result.messageId()).isIndexed()).isFalse();

    deduplicator.markIndexed(result.messageId(), 2);
    assertThat(messages.get(result.messageId()).isIndexed()).isTrue();
  }

  @Nested
  @DisplayName("concurrency")
  class Concurrency {

    private ExecutorService executor;

    @BeforeEach
    void setUpExecutor() {
      executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
      executor.shutdownNow();
    }

    @Test
    @DisplayName("should store a message once when the same delivery races")
    void shouldStoreOnceUnderRace() throws Exception {
      List<Callable<DeduplicationResult>> tasks = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        tasks.add(() -> deduplicator.process(incoming("Deploying 2.4 now", null)));
      }

      List<DeduplicationOutcome> outcomes = new ArrayList<>();
      for (Future<DeduplicationResult> future : executor.invokeAll(tasks)) {
        outcomes.add(future.get().outcome());
      }

      assertThat(outcomes).filteredOn(o -> o == DeduplicationOutcome.NEW).hasSize(1);
      assertThat(outcomes).filteredOn(o -> o == DeduplicationOutcome.DUPLICATE).hasSize(7);
      assertThat(messages).hasSize(1);
    }
  }
}
