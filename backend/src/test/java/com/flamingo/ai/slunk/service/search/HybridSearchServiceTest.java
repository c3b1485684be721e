package com.flamingo.ai.slunk.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.flamingo.ai.slunk.config.SlunkConfig;
import com.flamingo.ai.slunk.domain.enums.DocumentKind;
import com.flamingo.ai.slunk.elasticsearch.MessageDocument;
import com.flamingo.ai.slunk.exception.EmbeddingGenerationException;
import com.flamingo.ai.slunk.exception.QueryTimeoutException;
import com.flamingo.ai.slunk.service.embedding.EmbeddingProvider;
import com.flamingo.ai.slunk.service.query.HeuristicEntityRecognizer;
import com.flamingo.ai.slunk.service.query.QueryParser;
import com.flamingo.ai.slunk.service.query.TemporalHintExtractor;
import com.flamingo.ai.slunk.service.text.KeywordExtractor;
import com.flamingo.ai.slunk.support.HashingEmbeddingProvider;
import com.flamingo.ai.slunk.support.InMemoryMessageStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class HybridSearchServiceTest {

  private static final Instant NOW = Instant.parse("2024-03-15T15:00:00Z");

  private final KeywordExtractor keywordExtractor = new KeywordExtractor();
  private final HashingEmbeddingProvider embeddings = new HashingEmbeddingProvider();

  private InMemoryMessageStore store;
  private QueryParser queryParser;
  private SlunkConfig slunkConfig;
  private SimpleMeterRegistry meterRegistry;
  private ThreadPoolTaskExecutor searchExecutor;
  private HybridSearchService searchService;

  @BeforeEach
  void setUp() {
    store = new InMemoryMessageStore();
    queryParser =
        new QueryParser(
            new HeuristicEntityRecognizer(keywordExtractor),
            new TemporalHintExtractor(Clock.fixed(NOW, ZoneOffset.UTC)),
            keywordExtractor);
    slunkConfig = new SlunkConfig();
    meterRegistry = new SimpleMeterRegistry();
    searchExecutor = new ThreadPoolTaskExecutor();
    searchExecutor.setCorePoolSize(2);
    searchExecutor.setThreadNamePrefix("search-test-");
    searchExecutor.initialize();
    searchService = serviceWith(embeddings);
  }

  @AfterEach
  void tearDown() {
    searchExecutor.shutdown();
  }

  private HybridSearchService serviceWith(EmbeddingProvider provider) {
    return new HybridSearchService(
        store, provider, queryParser, searchExecutor, slunkConfig, meterRegistry);
  }

  private MessageDocument index(
      String id, String channel, String sender, String content, Instant timestamp) {
    MessageDocument document =
        MessageDocument.builder()
            .id(id)
            .channel(channel)
            .sender(sender)
            .content(content)
            .enhancedText(content)
            .keywords(keywordExtractor.extractKeywords(content))
            .embedding(embeddings.generate(content))
            .timestamp(timestamp)
            .build();
    store.upsert(document);
    return document;
  }

  private SearchResponse search(String text) {
    return searchService.search(text, 10, SearchFilters.NONE, null);
  }

  @Nested
  @DisplayName("ranking")
  class Ranking {

    @BeforeEach
    void setUpCorpus() {
      index("m1", "engineering", "alice", "redis cache eviction is too aggressive", NOW);
      index("m2", "engineering", "bob", "redis upgrade scheduled", NOW.minusSeconds(600));
      index("m3", "random", "carol", "who wants lunch today", NOW.minusSeconds(1200));
      index("m4", "engineering", "dave", "cache warmup after deploy", NOW.minusSeconds(1800));
    }

    @Test
    @DisplayName("should keep every score in the unit interval and sort by combined score")
    void shouldBoundAndSortScores() {
      SearchResponse response = search("redis cache");

      assertThat(response.results()).isNotEmpty();
      for (SearchResult result : response.results()) {
        assertThat(result.semanticScore()).isBetween(0.0, 1.0);
        assertThat(result.keywordScore()).isBetween(0.0, 1.0);
        assertThat(result.temporalScore()).isBetween(0.0, 1.0);
        assertThat(result.combinedScore()).isBetween(0.0, 1.0 + 1e-9);
      }
      assertThat(response.results())
          .extracting(SearchResult::combinedScore)
          .isSortedAccordingTo((a, b) -> Double.compare(b, a));
      assertThat(response.results().get(0).document().getId()).isEqualTo("m1");
      assertThat(response.guidance()).isNull();
    }

    @Test
    @DisplayName("should prefer the message inside yesterday over an older identical one")
    void shouldPreferMessagesFromYesterday() {
      String text = "deployment of the payments service finished";
      index("recent", "engineering", "erin", text, Instant.parse("2024-03-14T10:00:00Z"));
      index("old", "engineering", "erin", text, Instant.parse("2024-03-07T10:00:00Z"));

      SearchResponse response = search("payments deployment yesterday");

      assertThat(response.query().hasTemporalHint()).isTrue();
      List<String> ids = response.results().stream().map(r -> r.document().getId()).toList();
      assertThat(ids).contains("recent", "old");
      assertThat(ids.indexOf("recent")).isLessThan(ids.indexOf("old"));
      SearchResult recent = response.results().get(ids.indexOf("recent"));
      SearchResult old = response.results().get(ids.indexOf("old"));
      assertThat(recent.temporalScore()).isEqualTo(1.0);
      assertThat(old.temporalScore()).isLessThan(0.05);
    }

    @Test
    @DisplayName("should restrict results to channels named in the query")
    void shouldApplyChannelFromQuery() {
      SearchResponse response = search("lunch in #random");

      assertThat(response.results())
          .extracting(r -> r.document().getChannel())
          .containsOnly("random");
    }

    @Test
    @DisplayName("should apply explicit user filters")
    void shouldApplyUserFilter() {
      SearchFilters onlyBob = new SearchFilters(Set.of(), Set.of("@Bob"), null, false);

      SearchResponse response = searchService.search("redis", 10, onlyBob, null);

      assertThat(response.results())
          .extracting(r -> r.document().getId())
          .containsExactly("m2");
    }

    @Test
    @DisplayName("should honour the requested limit and fall back to the default")
    void shouldApplyLimits() {
      for (int i = 0; i < 15; i++) {
        index("bulk" + i, "ops", "bot", "nightly backup report " + i, NOW.minusSeconds(i));
      }

      assertThat(searchService.search("backup", 3, SearchFilters.NONE, null).results())
          .hasSize(3);
      assertThat(searchService.search("backup", 0, SearchFilters.NONE, null).results())
          .hasSize(slunkConfig.getSearch().getDefaultLimit());
    }

    @Test
    @DisplayName("should list newest messages first for a blank query")
    void shouldListNewestForBlankQuery() {
      SearchResponse response = search("   ");

      assertThat(response.results())
          .extracting(r -> r.document().getId())
          .containsExactly("m1", "m2", "m3", "m4");
    }

    @Test
    @DisplayName("should leave chunk documents out unless requested")
    void shouldFilterChunks() {
      MessageDocument chunk = index("chunk-1", "engineering", "alice", "redis cache notes", NOW);
      chunk.setKind(DocumentKind.CHUNK);

      assertThat(search("redis").results())
          .extracting(r -> r.document().getId())
          .doesNotContain("chunk-1");

      SearchFilters withChunks = new SearchFilters(Set.of(), Set.of(), null, true);
      assertThat(searchService.search("redis", 10, withChunks, null).results())
          .extracting(r -> r.document().getId())
          .contains("chunk-1");
    }
  }

  @Nested
  @DisplayName("keyword scoring")
  class KeywordScoring {

    private final MessageDocument document =
        MessageDocument.builder()
            .id("k")
            .content("Kubernetes upgrade broke the ingress")
            .keywords(List.of("kubernetes", "upgrade", "ingress"))
            .build();

    @Test
    @DisplayName("should grow with the share of matched keywords")
    void shouldBeMonotonic() {
      double none = HybridSearchService.keywordScore(List.of("kafka", "redis"), document);
      double half = HybridSearchService.keywordScore(List.of("kafka", "ingress"), document);
      double all = HybridSearchService.keywordScore(List.of("upgrade", "ingress"), document);

      assertThat(none).isZero();
      assertThat(half).isEqualTo(0.5);
      assertThat(all).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should match keyword fragments and content")
    void shouldMatchFragments() {
      assertThat(HybridSearchService.keywordScore(List.of("kube"), document)).isEqualTo(1.0);
      assertThat(HybridSearchService.keywordScore(List.of("broke"), document)).isEqualTo(1.0);
      assertThat(HybridSearchService.keywordScore(List.of(), document)).isZero();
    }
  }

  @Nested
  @DisplayName("failure handling")
  class FailureHandling {

    @Test
    @DisplayName("should fall back to keyword candidates when the query cannot be embedded")
    void shouldDegradeWithoutEmbedding() {
      index("m1", "engineering", "alice", "redis cache eviction", NOW);
      EmbeddingProvider failing = mock(EmbeddingProvider.class);
      when(failing.generate(anyString()))
          .thenThrow(new EmbeddingGenerationException("model unavailable"));

      SearchResponse response =
          serviceWith(failing).search("redis eviction", 10, SearchFilters.NONE, null);

      assertThat(response.results()).hasSize(1);
      SearchResult result = response.results().get(0);
      assertThat(result.semanticScore()).isZero();
      assertThat(result.keywordScore()).isEqualTo(1.0);
      assertThat(result.matchedKeywords()).containsExactly("redis", "eviction");
      assertThat(meterRegistry.counter("search.degraded", "reason", "embedding").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should explain how to broaden a search without results")
    void shouldReturnGuidanceWhenEmpty() {
      index("m1", "engineering", "alice", "redis cache eviction", NOW);

      SearchResponse response = search("kubernetes in #random yesterday");

      assertThat(response.isEmpty()).isTrue();
      assertThat(response.guidance())
          .startsWith("No results found. Try: different or broader keywords")
          .contains("a longer time range than 'yesterday'")
          .contains("removing the channel filter random");
    }

    @Test
    @DisplayName("should fail with a timeout when the deadline passes")
    void shouldTimeOut() {
      EmbeddingProvider slow = mock(EmbeddingProvider.class);
      when(slow.generate(anyString()))
          .thenAnswer(
              inv -> {
                Thread.sleep(2_000);
                return embeddings.generate(inv.getArgument(0));
              });

      assertThatThrownBy(() -> serviceWith(slow).search("redis", 10, SearchFilters.NONE, 50L))
          .isInstanceOf(QueryTimeoutException.class)
          .hasMessageContaining("search timed out after 50 ms");
      assertThat(meterRegistry.counter("search.timeout").count()).isEqualTo(1.0);
    }
  }
}
