package com.flamingo.ai.memoryvault.service.consolidation;

import com.flamingo.ai.memoryvault.config.VaultConfig;
import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.exception.ConsolidationConflictException;
import com.flamingo.ai.memoryvault.exception.EmbedderNotConfiguredException;
import com.flamingo.ai.memoryvault.service.embedding.Embedder;
import com.flamingo.ai.memoryvault.service.embedding.EmbeddingFutures;
import com.flamingo.ai.memoryvault.service.store.SearchHit;
import com.flamingo.ai.memoryvault.service.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Merges aged, mutually similar memories into single successor records.
 *
 * <p>Clustering is single-linkage and greedy: eligible records are visited oldest first, each
 * unclaimed record seeds a cluster with its unclaimed eligible neighbors, and members are claimed
 * once their merge commits. The merged record gets a fresh embedding of the merged text, the
 * highest member importance and the seed's category, namespace and agent. Members are tombstoned
 * in the same transaction that inserts the successor. A cluster is cut after the last member that
 * keeps the merged text within {@code vault.consolidation.max-merged-chars}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationService {

  private final VectorStore vectorStore;
  private final Embedder embedder;
  private final VaultConfig vaultConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs one consolidation pass.
   *
   * @return the number of merged records created
   */
  @Timed(value = "vault.consolidation.run", description = "Time to run a consolidation pass")
  public int runConsolidation() {
    VaultConfig.Consolidation settings = vaultConfig.getConsolidation();
    List<MemoryRecord> eligible = vectorStore.getOlderThan(settings.getMinAge());
    if (eligible.size() < 2) {
      log.debug("Consolidation skipped: {} eligible memories", eligible.size());
      return 0;
    }
    if (!embedder.isAvailable()) {
      throw new EmbedderNotConfiguredException();
    }

    Set<String> eligibleIds =
        eligible.stream().map(MemoryRecord::getId).collect(Collectors.toSet());
    Set<String> claimed = new HashSet<>();
    int merges = 0;

    for (MemoryRecord seed : eligible) {
      if (claimed.contains(seed.getId())) {
        continue;
      }
      Optional<float[]> seedVector = vectorStore.findVector(seed.getId());
      if (seedVector.isEmpty()) {
        log.debug("Memory {} vanished before consolidation, skipping", seed.getId());
        continue;
      }

      List<MemoryRecord> cluster = new ArrayList<>();
      cluster.add(seed);
      for (SearchHit hit :
          vectorStore.findSimilar(seedVector.get(), settings.getSimilarityThreshold())) {
        String id = hit.id();
        if (!id.equals(seed.getId()) && !claimed.contains(id) && eligibleIds.contains(id)) {
          cluster.add(hit.record());
        }
      }
      List<MemoryRecord> members =
          withinBudget(cluster, settings.getSeparator(), settings.getMaxMergedChars());
      if (members.size() < cluster.size()) {
        log.debug(
            "Cluster seeded by {} trimmed from {} to {} members to fit {} chars",
            seed.getId(),
            cluster.size(),
            members.size(),
            settings.getMaxMergedChars());
      }
      if (members.size() < 2) {
        continue;
      }

      if (merge(seed, members, settings)) {
        members.forEach(member -> claimed.add(member.getId()));
        merges++;
      }
    }

    meterRegistry.counter("vault.consolidation.merges").increment(merges);
    log.info("Consolidation pass complete: {} merges, {} eligible", merges, eligible.size());
    return merges;
  }

  /** The leading members whose joined text fits {@code maxChars}. */
  static List<MemoryRecord> withinBudget(
      List<MemoryRecord> cluster, String separator, int maxChars) {
    List<MemoryRecord> kept = new ArrayList<>();
    int length = 0;
    for (MemoryRecord member : cluster) {
      int added = member.getText().length() + (kept.isEmpty() ? 0 : separator.length());
      if (length + added > maxChars) {
        break;
      }
      kept.add(member);
      length += added;
    }
    return kept;
  }

  private boolean merge(
      MemoryRecord seed, List<MemoryRecord> cluster, VaultConfig.Consolidation settings) {
    String mergedText =
        cluster.stream()
            .map(MemoryRecord::getText)
            .collect(Collectors.joining(settings.getSeparator()));
    float importance = 0f;
    for (MemoryRecord member : cluster) {
      importance = Math.max(importance, member.getImportance());
    }

    // Embed before any transaction is opened
    float[] vector = EmbeddingFutures.await(embedder.embed(mergedText));

    MemoryRecord merged =
        MemoryRecord.builder()
            .id(UUID.randomUUID().toString())
            .text(mergedText)
            .category(seed.getCategory())
            .importance(importance)
            .namespace(seed.getNamespace())
            .agentId(seed.getAgentId())
            .build();
    List<String> memberIds = cluster.stream().map(MemoryRecord::getId).toList();

    try {
      vectorStore.insertConsolidated(merged, vector, memberIds);
    } catch (ConsolidationConflictException e) {
      log.warn(
          "Skipping merge seeded by {}: only {} of {} members could be marked",
          seed.getId(),
          e.getMarked(),
          memberIds.size());
      meterRegistry.counter("vault.consolidation.conflicts").increment();
      return false;
    }

    log.info("Merged {} memories into {}", memberIds.size(), merged.getId());
    return true;
  }
}
