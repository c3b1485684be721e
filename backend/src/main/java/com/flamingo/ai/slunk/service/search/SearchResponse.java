package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.service.query.ParsedQuery;
import java.util.List;

/**
 * Ranked results of one search.
 *
 * @param query the query as executed
 * @param results hits by descending combined score
 * @param guidance suggestions for rephrasing when there are no results, else {@code null}
 */
public record SearchResponse(ParsedQuery query, List<SearchResult> results, String guidance) {

  public SearchResponse {
    results = List.copyOf(results);
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }
}
