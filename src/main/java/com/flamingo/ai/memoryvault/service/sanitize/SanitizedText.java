package com.flamingo.ai.memoryvault.service.sanitize;

/**
 * Result of sanitizing text before it is stored.
 *
 * @param cleanedText text with context-confusing tags stripped
 * @param flagged whether the text looked like a prompt-injection attempt; flagged text is never
 *     stored
 */
public record SanitizedText(String cleanedText, boolean flagged) {}
