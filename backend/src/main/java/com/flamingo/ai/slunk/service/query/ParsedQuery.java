package com.flamingo.ai.slunk.service.query;

import com.flamingo.ai.slunk.domain.enums.QueryIntent;
import java.util.List;

/**
 * Structured form of a natural-language query. Immutable.
 *
 * @param originalText the text as received, or empty
 * @param intent the requested action
 * @param keywords content keywords in first-seen order, without stop words or claimed tokens
 * @param entities recognized named entities
 * @param channels channel filters
 * @param users user filters
 * @param temporalHint resolved time reference, or {@code null}
 */
public record ParsedQuery(
    String originalText,
    QueryIntent intent,
    List<String> keywords,
    List<RecognizedEntity> entities,
    List<String> channels,
    List<String> users,
    TemporalHint temporalHint) {

  public ParsedQuery {
    originalText = originalText == null ? "" : originalText;
    intent = intent == null ? QueryIntent.SEARCH : intent;
    keywords = List.copyOf(keywords);
    entities = List.copyOf(entities);
    channels = List.copyOf(channels);
    users = List.copyOf(users);
  }

  /** An empty query with the default intent. */
  public static ParsedQuery empty(String originalText) {
    return new ParsedQuery(
        originalText, QueryIntent.SEARCH, List.of(), List.of(), List.of(), List.of(), null);
  }

  public boolean hasTemporalHint() {
    return temporalHint != null;
  }

  public boolean isEmpty() {
    return keywords.isEmpty()
        && channels.isEmpty()
        && users.isEmpty()
        && entities.isEmpty()
        && temporalHint == null;
  }
}
