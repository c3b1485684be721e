package com.flamingo.ai.slunk.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.slunk.config.SlunkConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ScoringWeightsTest {

  @Test
  @DisplayName("should normalize weights to sum to one")
  void shouldNormalize() {
    ScoringWeights weights = new ScoringWeights(2, 1, 1);

    assertThat(weights.semantic()).isEqualTo(0.5);
    assertThat(weights.keyword()).isEqualTo(0.25);
    assertThat(weights.temporal()).isEqualTo(0.25);
  }

  @Test
  @DisplayName("should read the configured defaults")
  void shouldReadConfiguredWeights() {
    ScoringWeights weights = ScoringWeights.from(new SlunkConfig.Search.Weights());

    assertThat(weights.semantic()).isCloseTo(ScoringWeights.DEFAULT.semantic(), within(1e-12));
    assertThat(weights.keyword()).isCloseTo(ScoringWeights.DEFAULT.keyword(), within(1e-12));
    assertThat(weights.temporal()).isCloseTo(ScoringWeights.DEFAULT.temporal(), within(1e-12));
  }

  @Test
  @DisplayName("should keep combined scores in the unit interval")
  void shouldCombineWithinBounds() {
    assertThat(ScoringWeights.DEFAULT.combine(1, 1, 1)).isCloseTo(1.0, within(1e-9));
    assertThat(ScoringWeights.DEFAULT.combine(0, 0, 0)).isZero();
    assertThat(ScoringWeights.DEFAULT.combine(1, 0, 0)).isCloseTo(0.5, within(1e-9));
  }

  @Test
  @DisplayName("should reject negative or all-zero weights")
  void shouldRejectInvalidWeights() {
    assertThatThrownBy(() -> new ScoringWeights(-0.1, 0.5, 0.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ScoringWeights(0, 0, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
