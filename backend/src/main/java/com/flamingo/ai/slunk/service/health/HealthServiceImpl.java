package com.flamingo.ai.slunk.service.health;

import com.flamingo.ai.slunk.api.dto.response.SystemStats;
import com.flamingo.ai.slunk.domain.repository.DeduplicationRecordRepository;
import com.flamingo.ai.slunk.domain.repository.MessageRepository;
import com.flamingo.ai.slunk.exception.StoreUnavailableException;
import com.flamingo.ai.slunk.service.search.ConversationalSearchService;
import com.flamingo.ai.slunk.service.search.MessageStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final MessageRepository messageRepository;
  private final DeduplicationRecordRepository deduplicationRecordRepository;
  private final MessageStore messageStore;
  private final ConversationalSearchService conversationalSearchService;
  private final Clock clock;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    return SystemStats.builder()
        .totalMessages(messageRepository.count())
        .indexedMessages(messageRepository.countByIndexedTrue())
        .totalThreads(messageRepository.countDistinctThreads())
        .deduplicationRecords(deduplicationRecordRepository.count())
        .indexDocuments(indexDocumentCount())
        .activeSearchSessions(conversationalSearchService.activeSessionCount())
        .timestamp(clock.instant())
        .build();
  }

  private long indexDocumentCount() {
    try {
      return messageStore.count();
    } catch (StoreUnavailableException | CallNotPermittedException e) {
      log.warn("Index unavailable while collecting stats: {}", e.getMessage());
      return -1;
    }
  }
}
