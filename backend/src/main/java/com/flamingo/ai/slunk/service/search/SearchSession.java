package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.service.query.ParsedQuery;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/** Bounded history of one conversational search. Thread-safe. */
public class SearchSession {

  private final UUID id;
  private final Instant startedAt;
  private final int maxHistory;
  private final Deque<SearchTurn> history = new ArrayDeque<>();
  private Instant lastActivity;
  private int turnCount;

  SearchSession(UUID id, Instant startedAt, int maxHistory) {
    this.id = id;
    this.startedAt = startedAt;
    this.lastActivity = startedAt;
    this.maxHistory = maxHistory;
  }

  public UUID getId() {
    return id;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public synchronized Instant getLastActivity() {
    return lastActivity;
  }

  /** Turns in order, oldest first. */
  public synchronized List<SearchTurn> getHistory() {
    return List.copyOf(history);
  }

  /** The last {@code n} turns, oldest first. */
  public synchronized List<SearchTurn> recentTurns(int n) {
    List<SearchTurn> all = List.copyOf(history);
    return all.subList(Math.max(0, all.size() - n), all.size());
  }

  public synchronized int getTurnCount() {
    return turnCount;
  }

  /** Records a turn, dropping the oldest beyond the history bound; returns its turn number. */
  synchronized int append(SearchTurn turn) {
    history.addLast(turn);
    while (history.size() > maxHistory) {
      history.removeFirst();
    }
    lastActivity = turn.timestamp();
    return ++turnCount;
  }

  /**
   * One query of a session.
   *
   * @param query the text as typed
   * @param parsedQuery the text parsed on its own
   * @param enhancedQuery the query after session context was merged in
   * @param resultCount number of results returned
   * @param timestamp when the turn ran
   */
  public record SearchTurn(
      String query,
      ParsedQuery parsedQuery,
      ParsedQuery enhancedQuery,
      int resultCount,
      Instant timestamp) {}
}
