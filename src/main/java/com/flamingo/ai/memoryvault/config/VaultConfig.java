package com.flamingo.ai.memoryvault.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the memory vault. */
@Configuration
@ConfigurationProperties(prefix = "vault")
@Getter
@Setter
public class VaultConfig {

  /** SQLite database file, read by the datasource url. */
  private String dbPath = "memory-vault.db";

  /** Default number of memories returned by recall. */
  private int recallLimit = 5;

  /** Longest text accepted for a memory. */
  private int captureMaxChars = 2000;

  /** Hosts consult this before capturing after each turn. */
  private boolean autoCapture = true;

  /** Hosts consult this before injecting recalled memories into a prompt. */
  private boolean autoRecall = true;

  /** Similarity at or above which a new save is treated as a duplicate. */
  private double dedupThreshold = 0.95;

  /** How many kNN candidates to fetch per requested result, leaving room for re-ranking. */
  private int candidateMultiplier = 3;

  private Capture capture = new Capture();
  private Consolidation consolidation = new Consolidation();

  @Getter
  @Setter
  public static class Capture {
    /** Minimum heuristic score for a message to be captured automatically. */
    private double threshold = 0.3;

    private int maxPerTurn = 5;
  }

  @Getter
  @Setter
  public static class Consolidation {
    private boolean enabled = true;

    private long intervalMinutes = 360;

    /** Only records older than this are eligible for merging. */
    private Duration minAge = Duration.ofDays(7);

    private double similarityThreshold = 0.85;

    /** Separator placed between member texts in a merged record. */
    private String separator = " | ";

    /**
     * Longest merged text. Members past this budget stay unmerged, so the successor's embedding
     * always covers its whole text. Keep it at or below the embedder's input limit.
     */
    private int maxMergedChars = 8000;
  }
}
