package com.flamingo.ai.slunk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for ingestion, contextualization and hybrid search. */
@Configuration
@ConfigurationProperties(prefix = "slunk")
@Getter
@Setter
public class SlunkConfig {

  private Embedding embedding = new Embedding();
  private Contextualizer contextualizer = new Contextualizer();
  private Chunking chunking = new Chunking();
  private ThreadContext threadContext = new ThreadContext();
  private Query query = new Query();
  private Search search = new Search();
  private Ingestion ingestion = new Ingestion();

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding backend: "local" (all-MiniLM-L6-v2, on-device) or "openai". */
    private String provider = "local";

    /** Deadline for a single embedding call. */
    private Duration timeout = Duration.ofSeconds(10);

    private int maxInputChars = 5000;
  }

  @Getter
  @Setter
  public static class Contextualizer {
    /** Messages at or below this many code points are treated as short. */
    private int shortMessageThreshold = 10;

    /** Number of recent thread messages quoted in enhanced text. */
    private int recentContextMessages = 3;
  }

  @Getter
  @Setter
  public static class Chunking {
    private Duration timeWindow = Duration.ofMinutes(10);
    private int maxChunkSize = 20;
  }

  @Getter
  @Setter
  public static class ThreadContext {
    /** Size of the recent-messages window in a thread context. */
    private int recentWindow = 5;

    private long cacheSize = 1000;
    private Duration cacheTtl = Duration.ofMinutes(10);
  }

  @Getter
  @Setter
  public static class Query {
    /** Zone used to resolve relative temporal hints such as "yesterday". */
    private String zoneId = "UTC";
  }

  @Getter
  @Setter
  public static class Search {
    private int defaultLimit = 10;
    private int maxLimit = 100;
    private int candidateMultiplier = 3;
    private double minCombinedScore = 0.05;

    /** Widening applied around point-in-time hints before temporal decay starts. */
    private Duration pointTolerance = Duration.ofHours(6);

    /** Distance outside the hinted range at which the temporal score halves. */
    private Duration temporalHalfLife = Duration.ofHours(24);

    private Weights weights = new Weights();
    private int sessionMaxHistory = 10;
    private Duration sessionTtl = Duration.ofMinutes(30);

    @Getter
    @Setter
    public static class Weights {
      private double semantic = 0.5;
      private double keyword = 0.3;
      private double temporal = 0.2;
    }
  }

  @Getter
  @Setter
  public static class Ingestion {
    /** Reject new messages older than the latest accepted one in the same channel/thread. */
    private boolean enforceOrdering = true;

    /** Index conversation chunks built from each ingested batch. */
    private boolean indexChunks = true;
  }
}
