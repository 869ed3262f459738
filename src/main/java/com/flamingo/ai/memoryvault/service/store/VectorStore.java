package com.flamingo.ai.memoryvault.service.store;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Durable storage of memory records paired with their embeddings, with cosine nearest-neighbor
 * search. Consolidated records are tombstones: they stay stored but are invisible to searches.
 */
public interface VectorStore {

  /**
   * Commits the embedding dimension for this store. Idempotent for the same dimension.
   *
   * @param dimension the vector length
   * @throws com.flamingo.ai.memoryvault.exception.DimensionMismatchException if a different
   *     dimension was committed before; nothing is written in that case
   */
  void initialize(int dimension);

  /** The committed dimension, or empty while nothing has been stored yet. */
  OptionalInt committedDimension();

  /**
   * Persists a record and its vector atomically. Missing timestamps are set to now.
   *
   * @return the persisted record
   */
  MemoryRecord insert(MemoryRecord record, float[] vector);

  /**
   * Nearest active records by ascending cosine distance, over-fetched to {@code k} times the
   * configured candidate multiplier so callers can re-rank before truncating.
   */
  List<SearchHit> knnSearch(float[] vector, int k, MemoryFilter filter);

  /** Up to five nearest active records whose similarity is at least {@code threshold}. */
  List<SearchHit> findSimilar(float[] vector, double threshold);

  Optional<MemoryRecord> findById(String id);

  Optional<float[]> findVector(String id);

  /**
   * Hard-deletes a record and its vector.
   *
   * @return whether a record was removed
   */
  boolean deleteById(String id);

  /**
   * Tombstones the given records, pointing them at {@code successorId}. Must run inside the
   * transaction that inserted the successor.
   *
   * @throws com.flamingo.ai.memoryvault.exception.ConsolidationConflictException if any record
   *     could not be marked
   */
  void markConsolidated(Collection<String> ids, String successorId);

  /** Inserts a merged record and tombstones its members in one transaction. */
  MemoryRecord insertConsolidated(MemoryRecord merged, float[] vector, List<String> memberIds);

  /** Increments the access count of each record and stamps the access time. */
  void recordAccess(Collection<String> ids, Instant accessedAt);

  /** Active records created more than {@code age} ago, oldest first. */
  List<MemoryRecord> getOlderThan(Duration age);

  /** Active records, most recently updated first, optionally restricted to one category. */
  List<MemoryRecord> listActive(int limit, MemoryCategory category);

  /** All records, including consolidated ones, by ascending creation time. */
  List<MemoryRecord> exportAll();

  VaultStats stats();
}
