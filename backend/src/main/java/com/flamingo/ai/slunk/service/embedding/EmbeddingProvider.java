package com.flamingo.ai.slunk.service.embedding;

import java.util.List;

/** Produces fixed-size vector embeddings for text. */
public interface EmbeddingProvider {

  /**
   * Embeds a text. Identical input yields identical output.
   *
   * @param text non-blank text
   * @return vector of {@link #dimensions()} floats
   * @throws com.flamingo.ai.slunk.exception.EmbeddingGenerationException on blank input or
   *     provider failure
   * @throws com.flamingo.ai.slunk.exception.QueryTimeoutException when the provider exceeds its
   *     deadline
   */
  List<Float> generate(String text);

  /** Length of every vector this provider returns. */
  int dimensions();
}
