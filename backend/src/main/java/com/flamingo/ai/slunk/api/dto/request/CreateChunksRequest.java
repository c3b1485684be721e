package com.flamingo.ai.slunk.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for grouping messages into conversation chunks. Messages are given inline or as ids
 * of stored messages, not both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateChunksRequest {

  private List<@Valid MessageRequest> messages;

  private List<String> messageIds;

  @Positive(message = "Time window must be positive")
  private Long timeWindowSeconds;

  @Min(value = 1, message = "Max chunk size must be at least 1")
  @Max(value = 1000, message = "Max chunk size must not exceed 1000")
  private Integer maxChunkSize;

  /** Whether to also write the chunks to the search index. */
  private boolean index;

  @AssertTrue(message = "Provide either messages or messageIds")
  private boolean isExactlyOneSource() {
    boolean hasMessages = messages != null && !messages.isEmpty();
    boolean hasIds = messageIds != null && !messageIds.isEmpty();
    return hasMessages != hasIds;
  }

  /** Chunk ids derive from member ids, so indexed inline messages must carry their own. */
  @AssertTrue(message = "Inline messages need ids when chunks are indexed")
  private boolean isIdentifiedWhenIndexed() {
    if (!index || messages == null) {
      return true;
    }
    return messages.stream()
        .allMatch(m -> m != null && m.getId() != null && !m.getId().isBlank());
  }
}
