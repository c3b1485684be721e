package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import java.util.List;

/**
 * A scored search hit. All scores are in [0, 1].
 *
 * @param document the matched message or chunk
 * @param semanticScore embedding similarity to the query
 * @param keywordScore fraction of query keywords found
 * @param temporalScore closeness to the query's time hint; 1 without a hint
 * @param combinedScore weighted sum used for ranking
 * @param matchedKeywords query keywords found in the document
 */
public record SearchResult(
    MessageDocument document,
    double semanticScore,
    double keywordScore,
    double temporalScore,
    double combinedScore,
    List<String> matchedKeywords) {

  public SearchResult {
    matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
  }
}
