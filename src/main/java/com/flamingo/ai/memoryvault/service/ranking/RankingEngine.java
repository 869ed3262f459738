package com.flamingo.ai.memoryvault.service.ranking;

import java.time.Duration;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Scores recall candidates by similarity, re-ranked by freshness, importance and how often a
 * memory has been recalled before.
 *
 * <p>{@code score = similarity * (0.5 + 0.3 * recencyDecay + 0.2 * importance) * accessBoost}
 *
 * <p>Similarity gates the score; the bracketed term reaches 1.0 for a brand-new record of maximal
 * importance, and the access boost never exceeds 1.3.
 */
@Component
public class RankingEngine {

  public static final Duration HALF_LIFE = Duration.ofDays(30);
  public static final double MAX_ACCESS_BOOST = 1.3;

  static final double BASE_WEIGHT = 0.5;
  static final double RECENCY_WEIGHT = 0.3;
  static final double IMPORTANCE_WEIGHT = 0.2;
  static final double ACCESS_BOOST_STEP = 0.1;

  private static final double DECAY_LAMBDA_PER_MILLI = Math.log(2) / HALF_LIFE.toMillis();

  /**
   * Exponential decay with a 30-day half-life: 1 at age 0, 0.5 at 30 days. Records stamped in the
   * future count as age 0.
   */
  public double recencyDecay(Instant createdAt, Instant now) {
    long ageMillis = Math.max(0L, Duration.between(createdAt, now).toMillis());
    return Math.exp(-DECAY_LAMBDA_PER_MILLI * ageMillis);
  }

  /** {@code min(1.3, 1 + log2(1 + accessCount) * 0.1)}; 1.0 for a never-recalled record. */
  public double accessBoost(int accessCount) {
    int count = Math.max(0, accessCount);
    double log2 = Math.log1p(count) / Math.log(2);
    return Math.min(MAX_ACCESS_BOOST, 1.0 + log2 * ACCESS_BOOST_STEP);
  }

  public double finalScore(
      double similarity, Instant createdAt, double importance, int accessCount, Instant now) {
    double recency = recencyDecay(createdAt, now);
    return similarity
        * (BASE_WEIGHT + RECENCY_WEIGHT * recency + IMPORTANCE_WEIGHT * importance)
        * accessBoost(accessCount);
  }
}
