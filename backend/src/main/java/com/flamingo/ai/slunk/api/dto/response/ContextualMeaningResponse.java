package com.flamingo.ai.slunk.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the gloss of a short message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextualMeaningResponse {

  private String messageId;

  /** The gloss, or {@code null} when the message needs none. */
  private String meaning;
}
