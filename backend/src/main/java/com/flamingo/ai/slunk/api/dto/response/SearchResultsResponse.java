package com.flamingo.ai.slunk.api.dto.response;

import com.flamingo.ai.slunk.domain.enums.DocumentKind;
import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import com.flamingo.ai.slunk.service.search.SearchResponse;
import com.flamingo.ai.slunk.service.search.SearchResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a hybrid search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResultsResponse {

  private ParsedQueryResponse query;
  private List<Hit> results;
  private int totalResults;

  /** Suggestions for rephrasing; present only when there are no results. */
  private String guidance;

  /** Creates a SearchResultsResponse from a SearchResponse. */
  public static SearchResultsResponse fromResponse(SearchResponse response) {
    List<Hit> hits = response.results().stream().map(Hit::fromResult).toList();
    return SearchResultsResponse.builder()
        .query(ParsedQueryResponse.fromQuery(response.query()))
        .results(hits)
        .totalResults(hits.size())
        .guidance(response.guidance())
        .build();
  }

  /** One scored message or chunk. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Hit {
    private String id;
    private DocumentKind kind;
    private String channel;
    private String sender;
    private String threadId;
    private String content;
    private Instant timestamp;
    private Map<String, Integer> reactions;
    private List<String> memberIds;
    private double semanticScore;
    private double keywordScore;
    private double temporalScore;
    private double combinedScore;
    private List<String> matchedKeywords;

    static Hit fromResult(SearchResult result) {
      MessageDocument document = result.document();
      return Hit.builder()
          .id(document.getId())
          .kind(document.getKind())
          .channel(document.getChannel())
          .sender(document.getSender())
          .threadId(document.getThreadId())
          .content(document.getContent())
          .timestamp(document.getTimestamp())
          .reactions(document.getReactions())
          .memberIds(document.getMemberIds())
          .semanticScore(result.semanticScore())
          .keywordScore(result.keywordScore())
          .temporalScore(result.temporalScore())
          .combinedScore(result.combinedScore())
          .matchedKeywords(result.matchedKeywords())
          .build();
    }
  }
}
