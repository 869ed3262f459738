package com.flamingo.ai.memoryvault.exception;

import java.util.Collection;
import java.util.List;

/**
 * Thrown inside a consolidation transaction when some cluster members could not be marked, for
 * example because they were deleted or merged concurrently. The transaction is rolled back.
 */
public class ConsolidationConflictException extends RuntimeException {

  private final List<String> memberIds;
  private final int marked;

  public ConsolidationConflictException(Collection<String> memberIds, int marked) {
    super(
        "Only "
            + marked
            + " of "
            + memberIds.size()
            + " cluster members could be marked consolidated");
    this.memberIds = List.copyOf(memberIds);
    this.marked = marked;
  }

  public List<String> getMemberIds() {
    return memberIds;
  }

  public int getMarked() {
    return marked;
  }
}
