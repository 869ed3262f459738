package com.flamingo.ai.memoryvault.service.sanitize;

import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Default {@link Sanitizer}: flags common prompt-injection phrasing and strips XML-like tags that
 * could be mistaken for injected context when the memory is recalled later.
 */
@Component
public class PatternSanitizer implements Sanitizer {

  private static final List<Pattern> INJECTION_PATTERNS =
      List.of(
          Pattern.compile("\\bsystem\\s*:", Pattern.CASE_INSENSITIVE),
          Pattern.compile(
              "\\bignore\\s+(previous|above|all)\\s+instructions", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\byou\\s+are\\s+now\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bforget\\s+(everything|all|your)\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bnew\\s+instructions?\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("</?system>", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bdo\\s+not\\s+follow\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\boverride\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bjailbreak\\b", Pattern.CASE_INSENSITIVE));

  private static final Pattern CONTEXT_TAGS =
      Pattern.compile(
          "</?(?:system|instructions?|prompt|context|role)[^>]*>", Pattern.CASE_INSENSITIVE);

  @Override
  public SanitizedText sanitize(String text) {
    if (text == null) {
      return new SanitizedText("", false);
    }
    boolean flagged = INJECTION_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
    String cleaned = CONTEXT_TAGS.matcher(text).replaceAll("").trim();
    return new SanitizedText(cleaned, flagged);
  }
}
