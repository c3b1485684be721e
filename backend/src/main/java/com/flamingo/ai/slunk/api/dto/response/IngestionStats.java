package com.flamingo.ai.slunk.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-outcome counts for one ingested batch. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionStats {
  private int received;
  private int newMessages;
  private int duplicates;
  private int updated;
  private int reactionsUpdated;

  /** Messages refused by validation or ordering. */
  private int rejected;

  private int indexed;
  private int indexFailures;
  private int chunksIndexed;
}
