package com.flamingo.ai.memoryvault.service.store;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;

/**
 * A nearest-neighbor candidate.
 *
 * @param record the matched record
 * @param distance cosine distance to the query, {@code 1 - similarity}
 * @param similarity cosine similarity to the query
 */
public record SearchHit(MemoryRecord record, double distance, double similarity) {

  public static SearchHit ofSimilarity(MemoryRecord record, double similarity) {
    return new SearchHit(record, 1.0 - similarity, similarity);
  }

  public String id() {
    return record.getId();
  }
}
