package com.flamingo.ai.memoryvault.service.store;

/** Cosine similarity helpers over float32 vectors. */
public final class VectorMath {

  private VectorMath() {}

  /**
   * Cosine similarity in [-1, 1], computed in double precision. A vector compared with itself
   * yields exactly 1. Zero vectors have similarity 0 with everything.
   */
  public static double cosineSimilarity(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector lengths differ: " + a.length + " vs " + b.length);
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    double similarity = dot / Math.sqrt(normA * normB);
    return Math.max(-1.0, Math.min(1.0, similarity));
  }
}
