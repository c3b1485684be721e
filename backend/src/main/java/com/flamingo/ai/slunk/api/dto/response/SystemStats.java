package com.flamingo.ai.slunk.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for system-wide statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStats {
  private long totalMessages;
  private long indexedMessages;
  private long totalThreads;
  private long deduplicationRecords;

  /** Documents in the search index, messages and chunks; -1 when the index is unreachable. */
  private long indexDocuments;

  private long activeSearchSessions;
  private Instant timestamp;
}
