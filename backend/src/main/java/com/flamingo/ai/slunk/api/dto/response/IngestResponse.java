package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.domain.enums.DeduplicationOutcome;
import com.flamingo.ai.slunk.service.dedup.DeduplicationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a single ingested message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

  private String messageId;
  private DeduplicationOutcome outcome;
  private int version;
  private String contentHash;
  private boolean indexed;

  /** Creates an IngestResponse from a deduplication result. */
  public static IngestResponse fromResult(DeduplicationResult result) {
    return IngestResponse.builder()
        .messageId(result.messageId())
        .outcome(result.outcome())
        .version(result.version())
        .contentHash(result.contentHash())
        .indexed(result.message().isIndexed())
        .build();
  }
}
