package com.flamingo.ai.slunk.domain.enums;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/** What the user wants done with the results of a natural-language query. */
public enum QueryIntent {
  SEARCH(Set.of("find", "search", "look", "get", "where", "locate")),
  SHOW(Set.of("show", "display", "present", "reveal")),
  LIST(Set.of("list", "enumerate")),
  ANALYZE(Set.of("analyze", "analyse", "review", "examine", "study")),
  SUMMARIZE(Set.of("summarize", "summarise", "summary", "recap", "tldr")),
  COMPARE(Set.of("compare", "versus", "vs", "difference")),
  FILTER(Set.of("filter", "only", "exclude", "narrow"));

  private final Set<String> triggers;

  QueryIntent(Set<String> triggers) {
    this.triggers = triggers;
  }

  public Set<String> getTriggers() {
    return triggers;
  }

  /**
   * Returns the intent triggered by a lower-cased token, if any.
   *
   * @param token lower-cased query token
   * @return the matching intent, or empty when the token triggers none
   */
  public static Optional<QueryIntent> forToken(String token) {
    return Arrays.stream(values()).filter(intent -> intent.triggers.contains(token)).findFirst();
  }
}
