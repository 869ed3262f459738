package com.flamingo.ai.memoryvault.service.capture;

import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * One weighted signal of capture-worthiness.
 *
 * @param name rule name, used in logs and tests
 * @param predicate test over normalized text
 * @param weight amount added to the score when the predicate matches
 * @param category category suggested when this is the strongest matching rule
 */
public record CaptureRule(
    String name, Predicate<String> predicate, double weight, MemoryCategory category) {

  /** Builds a rule matching a case-insensitive regular expression anywhere in the text. */
  public static CaptureRule ofPattern(
      String name, String regex, double weight, MemoryCategory category) {
    Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    return new CaptureRule(name, text -> pattern.matcher(text).find(), weight, category);
  }

  public boolean matches(String normalizedText) {
    return predicate.test(normalizedText);
  }
}
