package com.flamingo.ai.memoryvault.service.vault;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.service.store.SearchHit;

/**
 * Outcome of a save. Only {@link Status#SAVED} inserts anything.
 *
 * @param status what happened
 * @param record the inserted record when saved
 * @param duplicateOf the nearest existing match when the text was a duplicate
 * @param message human-readable summary
 */
public record SaveResult(
    Status status, MemoryRecord record, SearchHit duplicateOf, String message) {

  public enum Status {
    SAVED,
    DUPLICATE,
    REJECTED_INVALID,
    REJECTED_FLAGGED
  }

  static SaveResult saved(MemoryRecord record) {
    return new SaveResult(
        Status.SAVED, record, null, "Saved to memory [" + record.getCategory().wireName() + "]");
  }

  static SaveResult duplicate(SearchHit nearest) {
    return new SaveResult(
        Status.DUPLICATE,
        null,
        nearest,
        String.format("Memory already exists (%.0f%% match)", nearest.similarity() * 100));
  }

  static SaveResult invalid() {
    return new SaveResult(
        Status.REJECTED_INVALID, null, null, "Text too short, too long, or mostly code");
  }

  static SaveResult flagged() {
    return new SaveResult(Status.REJECTED_FLAGGED, null, null, "Content flagged by safety filter");
  }

  public boolean isSaved() {
    return status == Status.SAVED;
  }
}
