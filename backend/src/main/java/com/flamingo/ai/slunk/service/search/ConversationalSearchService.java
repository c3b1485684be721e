package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.exception.SearchSessionNotFoundException;
import com.flamingo.ai.slunk.service.query.ParsedQuery;
import com.flamingo.ai.slunk.service.query.QueryParser;
import com.flamingo.ai.slunk.service.search.RefinementSuggestion.Type;
import com.flamingo.ai.slunk.service.search.SearchSession.SearchTurn;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Multi-turn search. Each session remembers its recent queries; terms, channels and users that
 * recur across the last turns are carried into the next query.
 */
@Service
@Slf4j
public class ConversationalSearchService {

  private static final int CONTEXT_TURNS = 3;
  private static final int MAX_SUGGESTIONS = 3;
  private static final int DOMINANT_TOPICS = 5;
  private static final int MANY_RESULTS = 8;
  private static final int FEW_RESULTS = 2;

  private final HybridSearchService hybridSearchService;
  private final QueryParser queryParser;
  private final Clock clock;
  private final int maxHistory;
  private final Cache<UUID, SearchSession> sessions;

  public ConversationalSearchService(
      HybridSearchService hybridSearchService,
      QueryParser queryParser,
      SlunkConfig slunkConfig,
      Clock clock) {
    this.hybridSearchService = hybridSearchService;
    this.queryParser = queryParser;
    this.clock = clock;
    this.maxHistory = slunkConfig.getSearch().getSessionMaxHistory();
    this.sessions =
        CacheBuilder.newBuilder()
            .expireAfterAccess(slunkConfig.getSearch().getSessionTtl())
            .build();
  }

  /** Opens a new session. */
  public SearchSession startSession() {
    SearchSession session = new SearchSession(UUID.randomUUID(), clock.instant(), maxHistory);
    sessions.put(session.getId(), session);
    log.info("Started search session {}", session.getId());
    return session;
  }

  /** Closes a session. */
  public void endSession(UUID sessionId) {
    getSession(sessionId);
    sessions.invalidate(sessionId);
    log.info("Ended search session {}", sessionId);
  }

  public SearchSession getSession(UUID sessionId) {
    SearchSession session = sessions.getIfPresent(sessionId);
    if (session == null) {
      throw new SearchSessionNotFoundException(sessionId);
    }
    return session;
  }

  public long activeSessionCount() {
    sessions.cleanUp();
    return sessions.size();
  }

  /**
   * Runs one turn of a session.
   *
   * @param sessionId the session
   * @param queryText the query text of this turn
   * @param limit maximum number of results
   * @param filters hard filters for this turn
   * @return results, refinement suggestions and session context
   * @throws SearchSessionNotFoundException when the session is unknown or expired
   */
  public ConversationalSearchResult search(
      UUID sessionId, String queryText, int limit, SearchFilters filters) {
    SearchSession session = getSession(sessionId);
    ParsedQuery parsed = queryParser.parse(queryText);
    ParsedQuery enhanced = withImpliedContext(parsed, session.recentTurns(CONTEXT_TURNS));

    SearchResponse response = hybridSearchService.search(enhanced, limit, filters);
    int turnNumber =
        session.append(
            new SearchTurn(
                queryText, parsed, enhanced, response.results().size(), clock.instant()));

    List<SearchTurn> history = session.getHistory();
    return new ConversationalSearchResult(
        sessionId,
        turnNumber,
        response,
        suggestRefinements(parsed, response.results().size(), turnNumber),
        session.recentTurns(CONTEXT_TURNS).stream().map(SearchTurn::query).toList(),
        dominantTopics(history));
  }

  /**
   * Adds keywords, channels and users that occur in more than one of the given turns. Nothing is
   * implied before the session has two turns. Channels and users become hard filters, so they are
   * only carried into a query that names none of its own.
   */
  static ParsedQuery withImpliedContext(ParsedQuery query, List<SearchTurn> recentTurns) {
    if (recentTurns.size() < 2) {
      return query;
    }
    return new ParsedQuery(
        query.originalText(),
        query.intent(),
        merge(query.keywords(), recurring(recentTurns, ParsedQuery::keywords)),
        query.entities(),
        query.channels().isEmpty()
            ? recurring(recentTurns, ParsedQuery::channels)
            : query.channels(),
        query.users().isEmpty() ? recurring(recentTurns, ParsedQuery::users) : query.users(),
        query.temporalHint());
  }

  static List<RefinementSuggestion> suggestRefinements(
      ParsedQuery query, int resultCount, int turnCount) {
    List<RefinementSuggestion> suggestions = new ArrayList<>();
    if (!query.hasTemporalHint()) {
      suggestions.add(
          new RefinementSuggestion(
              Type.ADD_TIME_FILTER,
              "Add time filter (e.g., 'last week', 'yesterday')",
              "Add temporal context to narrow results"));
    }
    if (query.channels().isEmpty() && resultCount > 0) {
      suggestions.add(
          new RefinementSuggestion(
              Type.ADD_CHANNEL_FILTER,
              "Filter by specific channels",
              "Add channel context to focus results"));
    }
    if (query.users().isEmpty() && resultCount > 0) {
      suggestions.add(
          new RefinementSuggestion(
              Type.ADD_USER_FILTER,
              "Filter by specific users",
              "Add user context to focus results"));
    }
    if (resultCount >= MANY_RESULTS) {
      suggestions.add(
          new RefinementSuggestion(
              Type.NARROW_SCOPE,
              "Narrow search scope with more specific terms",
              "Add more specific keywords"));
    }
    if (resultCount <= FEW_RESULTS) {
      suggestions.add(
          new RefinementSuggestion(
              Type.EXPAND_SCOPE,
              "Expand search with broader terms",
              "Use broader or alternative keywords"));
    }
    if (turnCount > 1) {
      suggestions.add(
          new RefinementSuggestion(
              Type.COMBINE_WITH_PREVIOUS,
              "Combine with previous search context",
              "Merge themes from recent searches"));
    }
    return List.copyOf(suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size())));
  }

  private static List<String> dominantTopics(List<SearchTurn> history) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    history.forEach(
        turn -> turn.parsedQuery().keywords().forEach(k -> counts.merge(k, 1, Integer::sum)));
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
        .limit(DOMINANT_TOPICS)
        .map(Map.Entry::getKey)
        .toList();
  }

  private static List<String> recurring(
      List<SearchTurn> turns, Function<ParsedQuery, List<String>> values) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (SearchTurn turn : turns) {
      values.apply(turn.parsedQuery()).forEach(v -> counts.merge(v, 1, Integer::sum));
    }
    return counts.entrySet().stream()
        .filter(e -> e.getValue() > 1)
        .map(Map.Entry::getKey)
        .toList();
  }

  private static List<String> merge(List<String> own, List<String> implied) {
    Set<String> merged = new LinkedHashSet<>(own);
    merged.addAll(implied);
    return List.copyOf(merged);
  }
}
