package com.flamingo.ai.memoryvault.service.store;

import com.flamingo.ai.memoryvault.config.VaultConfig;
import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.entity.MemoryVector;
import com.flamingo.ai.memoryvault.domain.entity.VaultMeta;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import com.flamingo.ai.memoryvault.domain.repository.MemoryRecordRepository;
import com.flamingo.ai.memoryvault.domain.repository.MemoryVectorRepository;
import com.flamingo.ai.memoryvault.domain.repository.VaultMetaRepository;
import com.flamingo.ai.memoryvault.exception.ConsolidationConflictException;
import com.flamingo.ai.memoryvault.exception.DimensionMismatchException;
import com.flamingo.ai.memoryvault.exception.MemoryNotFoundException;
import io.micrometer.core.annotation.Timed;
import jakarta.persistence.EntityManager;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * JPA-backed {@link VectorStore}.
 *
 * <p>Records and vectors live in two tables sharing a primary key. Nearest-neighbor search is an
 * exact scan over the vectors of active records, so results are deterministic and need no separate
 * index maintenance. The committed dimension is kept in {@code vault_meta} so a mismatch is
 * detected across restarts.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class VectorStoreImpl implements VectorStore {

  static final int SIMILAR_CANDIDATES = 5;

  private final MemoryRecordRepository recordRepository;
  private final MemoryVectorRepository vectorRepository;
  private final VaultMetaRepository metaRepository;
  private final EntityManager entityManager;
  private final VaultConfig vaultConfig;
  private final Clock clock;

  /** Cached after the dimension row is known to be committed. */
  private volatile Integer dimension;

  @Override
  @Transactional
  public void initialize(int requested) {
    if (requested <= 0) {
      throw new IllegalArgumentException("Embedding dimension must be positive: " + requested);
    }
    Integer known = dimension;
    if (known != null) {
      if (known != requested) {
        throw new DimensionMismatchException(known, requested);
      }
      return;
    }

    Optional<VaultMeta> stored = metaRepository.findById(VaultMeta.DIMENSIONS_KEY);
    if (stored.isPresent()) {
      int storedDimension = Integer.parseInt(stored.get().getValue());
      if (storedDimension != requested) {
        throw new DimensionMismatchException(storedDimension, requested);
      }
    } else {
      metaRepository.save(new VaultMeta(VaultMeta.DIMENSIONS_KEY, String.valueOf(requested)));
      log.info("Committed embedding dimension {} for the vault", requested);
    }
    cacheDimensionAfterCommit(requested);
  }

  private void cacheDimensionAfterCommit(int value) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              dimension = value;
            }
          });
    } else {
      dimension = value;
    }
  }

  @Override
  @Transactional(readOnly = true)
  public OptionalInt committedDimension() {
    Integer known = dimension;
    if (known != null) {
      return OptionalInt.of(known);
    }
    return metaRepository
        .findById(VaultMeta.DIMENSIONS_KEY)
        .map(meta -> OptionalInt.of(Integer.parseInt(meta.getValue())))
        .orElse(OptionalInt.empty());
  }

  @Override
  @Transactional
  @Timed(value = "vault.store.insert", description = "Time to insert a record with its vector")
  public MemoryRecord insert(MemoryRecord record, float[] vector) {
    initialize(vector.length);

    if (record.getImportance() < 0f || record.getImportance() > 1f) {
      throw new IllegalArgumentException(
          "Importance must be within [0, 1]: " + record.getImportance());
    }
    Instant now = clock.instant();
    if (record.getCreatedAt() == null) {
      record.setCreatedAt(now);
    }
    if (record.getUpdatedAt() == null) {
      record.setUpdatedAt(record.getCreatedAt());
    }

    entityManager.persist(record);
    entityManager.persist(
        MemoryVector.builder()
            .record(record)
            .embedding(vector.clone())
            .dimensions(vector.length)
            .build());
    entityManager.flush();

    log.debug("Inserted memory {} [{}]", record.getId(), record.getCategory());
    return record;
  }

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "vault.store.knn", description = "Time to run a kNN search")
  public List<SearchHit> knnSearch(float[] vector, int k, MemoryFilter filter) {
    if (k <= 0 || !hasVectors(vector)) {
      return List.of();
    }
    long wanted = (long) k * Math.max(1, vaultConfig.getCandidateMultiplier());
    int candidates = (int) Math.min(wanted, Integer.MAX_VALUE);
    return nearest(vector, candidates, filter != null ? filter : MemoryFilter.none());
  }

  @Override
  @Transactional(readOnly = true)
  public List<SearchHit> findSimilar(float[] vector, double threshold) {
    if (!hasVectors(vector)) {
      return List.of();
    }
    return nearest(vector, SIMILAR_CANDIDATES, MemoryFilter.none()).stream()
        .filter(hit -> hit.similarity() >= threshold)
        .toList();
  }

  /**
   * Whether a search can run: false for an empty store, mismatch error for a foreign dimension.
   */
  private boolean hasVectors(float[] vector) {
    OptionalInt committed = committedDimension();
    if (committed.isEmpty()) {
      return false;
    }
    if (committed.getAsInt() != vector.length) {
      throw new DimensionMismatchException(committed.getAsInt(), vector.length);
    }
    return true;
  }

  private List<SearchHit> nearest(float[] query, int limit, MemoryFilter filter) {
    return vectorRepository.findAllActive().stream()
        .filter(v -> filter.matches(v.getRecord()))
        .map(
            v ->
                SearchHit.ofSimilarity(
                    v.getRecord(), VectorMath.cosineSimilarity(query, v.getEmbedding())))
        .sorted(Comparator.comparingDouble(SearchHit::distance))
        .limit(limit)
        .toList();
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<MemoryRecord> findById(String id) {
    return recordRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<float[]> findVector(String id) {
    return vectorRepository.findById(id).map(MemoryVector::getEmbedding);
  }

  @Override
  @Transactional
  public boolean deleteById(String id) {
    vectorRepository.deleteVectorById(id);
    boolean removed = recordRepository.deleteRecordById(id) > 0;
    if (removed) {
      log.info("Deleted memory {}", id);
    }
    return removed;
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public void markConsolidated(Collection<String> ids, String successorId) {
    Set<String> members = new LinkedHashSet<>(ids);
    if (members.isEmpty()) {
      return;
    }
    MemoryRecord successor =
        recordRepository
            .findById(successorId)
            .orElseThrow(() -> new MemoryNotFoundException(successorId));

    int marked =
        recordRepository.markConsolidated(
            members, successorId, successor.getCreatedAt(), clock.instant());
    if (marked != members.size()) {
      throw new ConsolidationConflictException(members, marked);
    }
  }

  @Override
  @Transactional
  @Timed(value = "vault.store.merge", description = "Time to persist a consolidation merge")
  public MemoryRecord insertConsolidated(
      MemoryRecord merged, float[] vector, List<String> memberIds) {
    MemoryRecord saved = insert(merged, vector);
    markConsolidated(memberIds, saved.getId());
    return saved;
  }

  @Override
  @Transactional
  public void recordAccess(Collection<String> ids, Instant accessedAt) {
    if (ids.isEmpty()) {
      return;
    }
    recordRepository.recordAccess(ids, accessedAt);
  }

  @Override
  @Transactional(readOnly = true)
  public List<MemoryRecord> getOlderThan(Duration age) {
    Instant cutoff = clock.instant().minus(age);
    return recordRepository.findByConsolidatedIntoIsNullAndCreatedAtBeforeOrderByCreatedAtAsc(
        cutoff);
  }

  @Override
  @Transactional(readOnly = true)
  public List<MemoryRecord> listActive(int limit, MemoryCategory category) {
    PageRequest page = PageRequest.of(0, Math.max(1, limit));
    if (category != null) {
      return recordRepository.findByConsolidatedIntoIsNullAndCategoryOrderByUpdatedAtDesc(
          category, page);
    }
    return recordRepository.findByConsolidatedIntoIsNullOrderByUpdatedAtDesc(page);
  }

  @Override
  @Transactional(readOnly = true)
  public List<MemoryRecord> exportAll() {
    return recordRepository.findAllByOrderByCreatedAtAsc();
  }

  @Override
  @Transactional(readOnly = true)
  public VaultStats stats() {
    long total = recordRepository.count();
    long active = recordRepository.countByConsolidatedIntoIsNull();
    Map<String, Long> categories = new TreeMap<>();
    for (MemoryRecordRepository.CategoryCount row : recordRepository.countActiveByCategory()) {
      categories.put(row.getCategory().wireName(), row.getTotal());
    }
    return new VaultStats(total, active, total - active, categories);
  }
}
