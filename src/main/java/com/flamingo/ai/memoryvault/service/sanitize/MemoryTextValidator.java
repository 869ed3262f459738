package com.flamingo.ai.memoryvault.service.sanitize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Shape checks applied to text before it becomes a memory. */
public final class MemoryTextValidator {

  public static final int MIN_CHARS = 5;

  /** Text with more than this share of characters inside code fences is rejected. */
  static final double MAX_CODE_RATIO = 0.6;

  private static final Pattern CODE_BLOCK = Pattern.compile("```[\\s\\S]*?```");

  private MemoryTextValidator() {}

  /**
   * Whether the text is a plausible memory: at least 5 and at most {@code maxChars} characters,
   * and not mostly fenced code.
   */
  public static boolean isValid(String text, int maxChars) {
    if (text == null || text.isBlank() || text.length() < MIN_CHARS || text.length() > maxChars) {
      return false;
    }
    int codeChars = 0;
    Matcher matcher = CODE_BLOCK.matcher(text);
    while (matcher.find()) {
      codeChars += matcher.end() - matcher.start();
    }
    return (double) codeChars / text.length() <= MAX_CODE_RATIO;
  }
}
