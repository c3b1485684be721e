package com.flamingo.ai.slunk.service.search;

import java.util.List;
import java.util.UUID;

/**
 * Result of one conversational search turn.
 *
 * @param sessionId the session
 * @param turnNumber number of turns kept in the session, this one included
 * @param response the ranked results of the enhanced query
 * @param suggestions at most three refinements
 * @param recentQueries the last three query texts of the session
 * @param dominantTopics the most frequent keywords across the session
 */
public record ConversationalSearchResult(
    UUID sessionId,
    int turnNumber,
    SearchResponse response,
    List<RefinementSuggestion> suggestions,
    List<String> recentQueries,
    List<String> dominantTopics) {}
