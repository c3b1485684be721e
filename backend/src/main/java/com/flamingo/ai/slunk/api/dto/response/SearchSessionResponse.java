package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.service.search.SearchSession;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversational search session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchSessionResponse {

  private UUID sessionId;
  private Instant startedAt;
  private Instant lastActivity;
  private int turnCount;

  /** Creates a SearchSessionResponse from a SearchSession. */
  public static SearchSessionResponse fromSession(SearchSession session) {
    return SearchSessionResponse.builder()
        .sessionId(session.getId())
        .startedAt(session.getStartedAt())
        .lastActivity(session.getLastActivity())
        .turnCount(session.getTurnCount())
        .build();
  }
}
