package com.flamingo.ai.memoryvault.domain.repository;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for MemoryRecord entities. */
@Repository
public interface MemoryRecordRepository extends JpaRepository<MemoryRecord, String> {

  /** Active records created before the cutoff, oldest first. */
  List<MemoryRecord> findByConsolidatedIntoIsNullAndCreatedAtBeforeOrderByCreatedAtAsc(
      Instant cutoff);

  /** Active records, most recently updated first. */
  List<MemoryRecord> findByConsolidatedIntoIsNullOrderByUpdatedAtDesc(Pageable pageable);

  /** Active records of one category, most recently updated first. */
  List<MemoryRecord> findByConsolidatedIntoIsNullAndCategoryOrderByUpdatedAtDesc(
      MemoryCategory category, Pageable pageable);

  /** Every record, including consolidated ones, oldest first. */
  List<MemoryRecord> findAllByOrderByCreatedAtAsc();

  long countByConsolidatedIntoIsNull();

  /** Per-category counts over active records. */
  @Query(
      "SELECT m.category AS category, COUNT(m) AS total FROM MemoryRecord m "
          + "WHERE m.consolidatedInto IS NULL GROUP BY m.category")
  List<CategoryCount> countActiveByCategory();

  /**
   * Points active records at their successor. Only records created strictly before the successor
   * are touched, so a chain can never point backwards in time.
   *
   * @return number of records marked
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE MemoryRecord m SET m.consolidatedInto = :successorId, m.updatedAt = :now "
          + "WHERE m.id IN :ids AND m.consolidatedInto IS NULL "
          + "AND m.createdAt < :successorCreatedAt")
  int markConsolidated(
      @Param("ids") Collection<String> ids,
      @Param("successorId") String successorId,
      @Param("successorCreatedAt") Instant successorCreatedAt,
      @Param("now") Instant now);

  /** Bumps the access counter and last-access time of the given records. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE MemoryRecord m SET m.accessCount = m.accessCount + 1, m.lastAccessedAt = :at "
          + "WHERE m.id IN :ids")
  int recordAccess(@Param("ids") Collection<String> ids, @Param("at") Instant at);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM MemoryRecord m WHERE m.id = :id")
  int deleteRecordById(@Param("id") String id);

  /** Projection for per-category counts. */
  interface CategoryCount {
    MemoryCategory getCategory();

    long getTotal();
  }
}
