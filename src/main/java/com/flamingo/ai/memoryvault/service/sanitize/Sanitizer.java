package com.flamingo.ai.memoryvault.service.sanitize;

/** Cleans text and flags content that must not be stored. */
public interface Sanitizer {

  SanitizedText sanitize(String text);
}
