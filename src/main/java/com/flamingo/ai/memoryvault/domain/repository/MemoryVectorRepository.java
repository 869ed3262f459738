package com.flamingo.ai.memoryvault.domain.repository;

import com.flamingo.ai.memoryvault.domain.entity.MemoryVector;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for MemoryVector entities. */
@Repository
public interface MemoryVectorRepository extends JpaRepository<MemoryVector, String> {

  /** Vectors of every active record, with the record fetched alongside. */
  @Query(
      "SELECT v FROM MemoryVector v JOIN FETCH v.record m WHERE m.consolidatedInto IS NULL")
  List<MemoryVector> findAllActive();

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM MemoryVector v WHERE v.id = :id")
  int deleteVectorById(@Param("id") String id);
}
