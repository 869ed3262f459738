package com.flamingo.ai.memoryvault.service.capture;

import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;

/**
 * Outcome of evaluating a piece of text for capture.
 *
 * @param score summed rule weights minus penalties, never negative
 * @param category category of the strongest matching rule
 */
public record CaptureResult(double score, MemoryCategory category) {

  public static final CaptureResult REJECTED = new CaptureResult(0.0, MemoryCategory.OTHER);
}
