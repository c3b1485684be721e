package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import com.flamingo.ai.slunk.exception.EmbeddingGenerationException;
import com.flamingo.ai.slunk.exception.QueryTimeoutException;
import com.flamingo.ai.slunk.service.embedding.EmbeddingProvider;
import com.flamingo.ai.slunk.service.embedding.VectorMath;
import com.flamingo.ai.slunk.service.query.DateRange;
import com.flamingo.ai.slunk.service.query.ParsedQuery;
import com.flamingo.ai.slunk.service.query.QueryParser;
import com.flamingo.ai.slunk.service.query.TemporalHint;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Ranks messages by a weighted blend of semantic similarity, keyword overlap and temporal
 * closeness.
 *
 * <p>Candidates are gathered from three store queries (nearest neighbours of the query embedding,
 * keyword matches and, when the query names a time, messages inside that time range) and every
 * candidate is then scored on all three signals. If the query cannot be embedded, the search
 * continues with keyword and time candidates only.
 */
@Service
@Slf4j
public class HybridSearchService {

  private static final String NO_RESULTS = "No results found. Try: ";

  private static final Comparator<SearchResult> RANKING =
      Comparator.comparingDouble(SearchResult::combinedScore)
          .reversed()
          .thenComparing(
              r -> r.document().getTimestamp(),
              Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

  private final MessageStore messageStore;
  private final EmbeddingProvider embeddingProvider;
  private final QueryParser queryParser;
  private final ThreadPoolTaskExecutor searchExecutor;
  private final SlunkConfig slunkConfig;
  private final MeterRegistry meterRegistry;

  public HybridSearchService(
      MessageStore messageStore,
      EmbeddingProvider embeddingProvider,
      QueryParser queryParser,
      @Qualifier("searchExecutor") ThreadPoolTaskExecutor searchExecutor,
      SlunkConfig slunkConfig,
      MeterRegistry meterRegistry) {
    this.messageStore = messageStore;
    this.embeddingProvider = embeddingProvider;
    this.queryParser = queryParser;
    this.searchExecutor = searchExecutor;
    this.slunkConfig = slunkConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Parses and runs a query, optionally under a deadline.
   *
   * @param queryText free query text
   * @param limit maximum number of results; non-positive means the configured default
   * @param filters hard filters
   * @param timeoutMillis deadline for the whole search, or {@code null} for none
   * @return ranked results
   * @throws QueryTimeoutException when the deadline passes
   */
  public SearchResponse search(
      String queryText, int limit, SearchFilters filters, Long timeoutMillis) {
    ParsedQuery parsed = queryParser.parse(queryText);
    if (timeoutMillis == null) {
      return search(parsed, limit, filters);
    }
    Duration timeout = Duration.ofMillis(timeoutMillis);
    Future<SearchResponse> future = searchExecutor.submit(() -> search(parsed, limit, filters));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      meterRegistry.counter("search.timeout").increment();
      throw new QueryTimeoutException("search", timeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new QueryTimeoutException("search", timeout, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Search failed", e.getCause());
    }
  }

  /**
   * Runs a parsed query.
   *
   * @param query the parsed query
   * @param limit maximum number of results; non-positive means the configured default
   * @param filters hard filters; the query's own channels and users are added to them
   * @return results by descending combined score, ties broken by newer timestamp
   */
  @Timed(value = "search.hybrid", description = "Time for hybrid message search")
  public SearchResponse search(ParsedQuery query, int limit, SearchFilters filters) {
    SlunkConfig.Search config = slunkConfig.getSearch();
    int effectiveLimit =
        limit <= 0 ? config.getDefaultLimit() : Math.min(limit, config.getMaxLimit());
    SearchFilters effectiveFilters =
        (filters == null ? SearchFilters.NONE : filters)
            .withAdditional(Set.copyOf(query.channels()), Set.copyOf(query.users()));
    int candidateLimit = effectiveLimit * config.getCandidateMultiplier();

    Map<String, Candidate> candidates = new LinkedHashMap<>();
    List<Float> queryVector = embedQuery(query);
    if (queryVector != null) {
      List<VectorMatch> matches =
          messageStore.queryByVector(queryVector, candidateLimit, effectiveFilters);
      for (VectorMatch match : matches) {
        candidates.put(match.document().getId(), new Candidate(match.document(), match.distance()));
      }
    }
    if (!query.keywords().isEmpty()) {
      addCandidates(
          candidates,
          messageStore.queryByKeywords(query.keywords(), candidateLimit, effectiveFilters));
    }
    DateRange hintRange = hintRange(query.temporalHint());
    if (hintRange != null) {
      addCandidates(
          candidates, messageStore.queryByTimeRange(hintRange, candidateLimit, effectiveFilters));
    }
    if (queryVector == null && query.keywords().isEmpty() && hintRange == null) {
      addCandidates(candidates, messageStore.getAll(candidateLimit, effectiveFilters));
    }

    ScoringWeights weights = ScoringWeights.from(config.getWeights());
    List<SearchResult> results = new ArrayList<>();
    for (Candidate candidate : candidates.values()) {
      if (!effectiveFilters.accepts(candidate.document())) {
        continue;
      }
      double semantic = semanticScore(candidate, queryVector);
      List<String> matched = matchedKeywords(query.keywords(), candidate.document());
      double keyword =
          query.keywords().isEmpty() ? 0.0 : (double) matched.size() / query.keywords().size();
      double temporal = temporalScore(hintRange, candidate.document().getTimestamp());
      double combined = weights.combine(semantic, keyword, temporal);
      if (combined >= config.getMinCombinedScore()) {
        results.add(
            new SearchResult(
                candidate.document(), semantic, keyword, temporal, combined, matched));
      }
    }
    results.sort(RANKING);
    List<SearchResult> top = results.subList(0, Math.min(effectiveLimit, results.size()));

    meterRegistry.counter("search.requests", "result", top.isEmpty() ? "empty" : "hit").increment();
    log.debug(
        "Search '{}' scored {} candidates, returning {}",
        query.originalText(),
        candidates.size(),
        top.size());
    return new SearchResponse(
        query, top, top.isEmpty() ? guidance(query, effectiveFilters) : null);
  }

  private static void addCandidates(
      Map<String, Candidate> candidates, List<MessageDocument> documents) {
    for (MessageDocument document : documents) {
      candidates.putIfAbsent(document.getId(), new Candidate(document, null));
    }
  }

  private List<Float> embedQuery(ParsedQuery query) {
    if (query.originalText().isBlank()) {
      return null;
    }
    try {
      return embeddingProvider.generate(query.originalText());
    } catch (EmbeddingGenerationException e) {
      meterRegistry.counter("search.degraded", "reason", "embedding").increment();
      log.warn("Query embedding failed, searching by keywords and time only: {}", e.getMessage());
      return null;
    }
  }

  /** The hint's range, widened by the point tolerance for single-day hints. */
  DateRange hintRange(TemporalHint hint) {
    if (hint == null) {
      return null;
    }
    return hint.isPointInTime()
        ? hint.range().widen(slunkConfig.getSearch().getPointTolerance())
        : hint.range();
  }

  static double semanticScore(Candidate candidate, List<Float> queryVector) {
    if (candidate.distance() != null) {
      return clamp(1.0 - candidate.distance());
    }
    List<Float> embedding = candidate.document().getEmbedding();
    if (queryVector == null || embedding == null || embedding.size() != queryVector.size()) {
      return 0.0;
    }
    return clamp(VectorMath.cosineSimilarity(queryVector, embedding));
  }

  /** Fraction of query keywords found, exactly or as a substring, in the keywords or content. */
  static double keywordScore(List<String> keywords, MessageDocument document) {
    if (keywords.isEmpty()) {
      return 0.0;
    }
    return (double) matchedKeywords(keywords, document).size() / keywords.size();
  }

  static List<String> matchedKeywords(List<String> keywords, MessageDocument document) {
    Set<String> documentKeywords = new HashSet<>();
    if (document.getKeywords() != null) {
      document.getKeywords().forEach(k -> documentKeywords.add(k.toLowerCase(Locale.ROOT)));
    }
    String content =
        document.getContent() == null ? "" : document.getContent().toLowerCase(Locale.ROOT);
    return keywords.stream()
        .map(k -> k.toLowerCase(Locale.ROOT))
        .filter(
            k ->
                documentKeywords.contains(k)
                    || content.contains(k)
                    || documentKeywords.stream().anyMatch(dk -> dk.contains(k)))
        .toList();
  }

  /** 1 inside the range, halving every half-life outside it; 1 when there is no range. */
  double temporalScore(DateRange range, Instant timestamp) {
    if (range == null) {
      return 1.0;
    }
    if (timestamp == null) {
      return 0.0;
    }
    Duration distance = range.distanceTo(timestamp);
    if (distance.isZero()) {
      return 1.0;
    }
    double halfLives =
        (double) distance.toMillis() / slunkConfig.getSearch().getTemporalHalfLife().toMillis();
    return Math.pow(0.5, halfLives);
  }

  private static String guidance(ParsedQuery query, SearchFilters filters) {
    List<String> tips = new ArrayList<>();
    if (query.keywords().size() > 2) {
      tips.add("fewer or broader keywords");
    } else {
      tips.add("different or broader keywords");
    }
    if (query.hasTemporalHint() || filters.dateRange() != null) {
      String current =
          query.hasTemporalHint() ? query.temporalHint().rawValue() : "the given dates";
      tips.add("a longer time range than '" + current + "'");
    }
    if (!filters.channels().isEmpty()) {
      tips.add("removing the channel filter " + String.join(", ", filters.channels()));
    }
    if (!filters.users().isEmpty()) {
      tips.add("removing the user filter " + String.join(", ", filters.users()));
    }
    return NO_RESULTS + String.join(" | ", tips);
  }

  private static double clamp(double value) {
    if (Double.isNaN(value)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }

  record Candidate(MessageDocument document, Double distance) {}
}
