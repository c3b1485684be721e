package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.service.search.ConversationalSearchResult;
import com.flamingo.ai.slunk.service.search.RefinementSuggestion;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one conversational search turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationalSearchResponse {

  private UUID sessionId;
  private int turnNumber;
  private SearchResultsResponse results;
  private List<RefinementSuggestion> suggestions;
  private List<String> recentQueries;
  private List<String> dominantTopics;

  /** Creates a ConversationalSearchResponse from a ConversationalSearchResult. */
  public static ConversationalSearchResponse fromResult(ConversationalSearchResult result) {
    return ConversationalSearchResponse.builder()
        .sessionId(result.sessionId())
        .turnNumber(result.turnNumber())
        .results(SearchResultsResponse.fromResponse(result.response()))
        .suggestions(result.suggestions())
        .recentQueries(result.recentQueries())
        .dominantTopics(result.dominantTopics())
        .build();
  }
}
