package com.flamingo.ai.slunk.service.search;

import com.flamingo.ai.slunk.config.SlunkConfig;

/**
 * Relative importance of the three relevance signals. Normalized on construction so the weights
 * sum to 1 and a combined score stays in [0, 1].
 *
 * @param semantic weight of embedding similarity
 * @param keyword weight of keyword overlap
 * @param temporal weight of closeness to the query's time hint
 */
public record ScoringWeights(double semantic, double keyword, double temporal) {

  public static final ScoringWeights DEFAULT = new ScoringWeights(0.5, 0.3, 0.2);

  public ScoringWeights {
    if (semantic < 0 || keyword < 0 || temporal < 0) {
      throw new IllegalArgumentException("Scoring weights must not be negative");
    }
    double sum = semantic + keyword + temporal;
    if (sum <= 0) {
      throw new IllegalArgumentException("At least one scoring weight must be positive");
    }
    semantic = semantic / sum;
    keyword = keyword / sum;
    temporal = temporal / sum;
  }

  public static ScoringWeights from(SlunkConfig.Search.Weights weights) {
    return new ScoringWeights(weights.getSemantic(), weights.getKeyword(), weights.getTemporal());
  }

  public double combine(double semanticScore, double keywordScore, double temporalScore) {
    return semantic * semanticScore + keyword * keywordScore + temporal * temporalScore;
  }
}
