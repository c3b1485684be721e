package com.flamingo.ai.slunk.service.embedding;

import java.util.List;

/** Vector helpers shared by ranking code. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity of two vectors.
   *
   * @return similarity in [-1, 1]; 0 when either vector is empty, zero or the sizes differ
   */
  public static double cosineSimilarity(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
