package com.flamingo.ai.slunk.service.search;

/**
 * A proposed next step for a conversational search.
 *
 * @param type the kind of refinement
 * @param description what to do, for display
 * @param suggestedModification how the query would change
 */
public record RefinementSuggestion(Type type, String description, String suggestedModification) {

  /** Kinds of refinement offered after a turn. */
  public enum Type {
    ADD_TIME_FILTER,
    ADD_CHANNEL_FILTER,
    ADD_USER_FILTER,
    NARROW_SCOPE,
    EXPAND_SCOPE,
    COMBINE_WITH_PREVIOUS
  }
}
