package com.flamingo.ai.memoryvault.service.capture;

import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import java.text.Normalizer;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores how worth remembering a piece of text is, without touching storage.
 *
 * <p>Every rule whose pattern matches adds its weight; the category comes from the highest-weight
 * match, with earlier rules winning ties. Code-heavy or heavily structured text is penalised.
 * Thresholds, per-turn caps and deduplication are left to the caller.
 */
@Component
public class CaptureHeuristicEvaluator {

  public static final int MIN_LENGTH = 20;
  public static final int MAX_LENGTH = 2000;

  static final double CODE_FENCE_PENALTY = 0.3;
  static final double HEADER_PENALTY = 0.2;

  /** Matches memory blocks injected by recall, so recalled context is never captured again. */
  private static final Pattern RECALLED_MEMORY_MARKER =
      Pattern.compile("<relevant-memories|<vault-memories");

  private static final Pattern MARKDOWN_HEADER = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
  private static final String CODE_FENCE = "```";

  /** Ordered: ties on weight resolve to the earlier rule. */
  public static final List<CaptureRule> RULES =
      List.of(
          CaptureRule.ofPattern(
              "explicit-memory-request",
              "\\b(remember|don't forget|note that|keep in mind|save this)\\b",
              0.5,
              MemoryCategory.PREFERENCE),
          CaptureRule.ofPattern(
              "personal-info",
              "\\b(my |I prefer|I use |I like |I need |we decided|I always|I never)\\b",
              0.3,
              MemoryCategory.PREFERENCE),
          CaptureRule.ofPattern(
              "structured-data",
              "(\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b"
                  + "|\\b\\d{3}[-.]?\\d{3}[-.]?\\d{4}\\b"
                  + "|\\b\\d{4}[-/]\\d{2}[-/]\\d{2}\\b)",
              0.3,
              MemoryCategory.ENTITY),
          CaptureRule.ofPattern(
              "technical-decision",
              "\\b(we'll use|switched to|let's go with|migrated to|chose|decided on|going with)\\b",
              0.3,
              MemoryCategory.DECISION),
          CaptureRule.ofPattern(
              "preference-language",
              "\\b(always|never|prefer|instead of|rather than|better than)\\b",
              0.2,
              MemoryCategory.PREFERENCE));

  private final List<CaptureRule> rules;

  public CaptureHeuristicEvaluator() {
    this(RULES);
  }

  CaptureHeuristicEvaluator(List<CaptureRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public CaptureResult evaluate(String text) {
    if (text == null || text.length() < MIN_LENGTH || text.length() > MAX_LENGTH) {
      return CaptureResult.REJECTED;
    }
    if (RECALLED_MEMORY_MARKER.matcher(text).find()) {
      return CaptureResult.REJECTED;
    }

    String normalized = normalize(text);
    double score = 0;
    double bestWeight = 0;
    MemoryCategory category = MemoryCategory.OTHER;
    for (CaptureRule rule : rules) {
      if (rule.matches(normalized)) {
        score += rule.weight();
        if (rule.weight() > bestWeight) {
          bestWeight = rule.weight();
          category = rule.category();
        }
      }
    }

    if (countOccurrences(text, CODE_FENCE) >= 2) {
      score -= CODE_FENCE_PENALTY;
    }
    if (countMatches(MARKDOWN_HEADER, text) >= 3) {
      score -= HEADER_PENALTY;
    }
    return new CaptureResult(Math.max(0, score), category);
  }

  /** NFKC plus straight apostrophes, so typographic quotes still hit the rules. */
  static String normalize(String text) {
    return Normalizer.normalize(text, Normalizer.Form.NFKC).replace('\u2019', '\'');
  }

  private static int countOccurrences(String text, String token) {
    int count = 0;
    int from = text.indexOf(token);
    while (from >= 0) {
      count++;
      from = text.indexOf(token, from + token.length());
    }
    return count;
  }

  private static int countMatches(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
