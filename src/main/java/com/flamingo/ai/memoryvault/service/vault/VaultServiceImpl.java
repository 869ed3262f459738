package com.flamingo.ai.memoryvault.service.vault;

import com.flamingo.ai.memoryvault.config.VaultConfig;
import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import com.flamingo.ai.memoryvault.exception.EmbedderNotConfiguredException;
import com.flamingo.ai.memoryvault.exception.MemoryNotFoundException;
import com.flamingo.ai.memoryvault.exception.VaultStorageException;
import com.flamingo.ai.memoryvault.service.embedding.Embedder;
import com.flamingo.ai.memoryvault.service.embedding.EmbeddingFutures;
import com.flamingo.ai.memoryvault.service.ranking.RankingEngine;
import com.flamingo.ai.memoryvault.service.sanitize.MemoryTextValidator;
import com.flamingo.ai.memoryvault.service.sanitize.SanitizedText;
import com.flamingo.ai.memoryvault.service.sanitize.Sanitizer;
import com.flamingo.ai.memoryvault.service.store.MemoryFilter;
import com.flamingo.ai.memoryvault.service.store.SearchHit;
import com.flamingo.ai.memoryvault.service.store.VaultStats;
import com.flamingo.ai.memoryvault.service.store.VectorStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/** Implementation of VaultService composing the store, the ranking engine and the embedder. */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultServiceImpl implements VaultService {

  static final String CONTEXT_OPEN_TAG = "<vault-memories trust=\"unverified\">";
  static final String CONTEXT_CLOSE_TAG = "</vault-memories>";

  private final VectorStore vectorStore;
  private final RankingEngine rankingEngine;
  private final Embedder embedder;
  private final Sanitizer sanitizer;
  private final VaultConfig vaultConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Override
  @Timed(value = "vault.save", description = "Time to save a memory")
  public SaveResult save(String text, SaveOptions options) {
    SaveOptions opts = options != null ? options : SaveOptions.defaults();
    int maxChars = vaultConfig.getCaptureMaxChars();

    if (!MemoryTextValidator.isValid(text, maxChars)) {
      meterRegistry.counter("vault.save.rejected", "reason", "invalid").increment();
      return SaveResult.invalid();
    }

    SanitizedText sanitized = sanitizer.sanitize(text);
    if (sanitized.flagged()) {
      log.warn("Memory rejected by sanitizer: \"{}\"", preview(text, 60));
      meterRegistry.counter("vault.save.rejected", "reason", "flagged").increment();
      return SaveResult.flagged();
    }
    String clean = sanitized.cleanedText();
    if (!MemoryTextValidator.isValid(clean, maxChars)) {
      meterRegistry.counter("vault.save.rejected", "reason", "invalid").increment();
      return SaveResult.invalid();
    }
    if (opts.importance() != null && (opts.importance() < 0f || opts.importance() > 1f)) {
      throw new IllegalArgumentException("Importance must be between 0.0 and 1.0");
    }

    float[] vector = embed(clean);

    return storage(
        "save",
        () -> {
          List<SearchHit> similar =
              vectorStore.findSimilar(vector, vaultConfig.getDedupThreshold());
          if (!similar.isEmpty()) {
            SearchHit nearest = similar.get(0);
            log.debug(
                "Duplicate of memory {} ({} similarity), not saving",
                nearest.id(),
                nearest.similarity());
            meterRegistry.counter("vault.save.duplicate").increment();
            return SaveResult.duplicate(nearest);
          }

          MemoryRecord record =
              MemoryRecord.builder()
                  .id(UUID.randomUUID().toString())
                  .text(clean)
                  .category(opts.category() != null ? opts.category() : MemoryCategory.OTHER)
                  .importance(
                      opts.importance() != null
                          ? opts.importance()
                          : MemoryRecord.DEFAULT_IMPORTANCE)
                  .namespace(
                      opts.namespace() != null
                          ? opts.namespace()
                          : MemoryRecord.DEFAULT_NAMESPACE)
                  .agentId(opts.agentId())
                  .metadata(opts.metadata())
                  .build();

          MemoryRecord saved = vectorStore.insert(record, vector);
          meterRegistry.counter("vault.save.count").increment();
          log.info(
              "Saved memory {} [{}]: \"{}\"",
              saved.getId(),
              saved.getCategory().wireName(),
              preview(clean, 60));
          return SaveResult.saved(saved);
        });
  }

  @Override
  @Timed(value = "vault.recall", description = "Time to recall memories")
  public List<RecalledMemory> recall(String query, int limit, MemoryFilter filter) {
    if (query == null || query.isBlank() || limit <= 0) {
      return List.of();
    }
    float[] vector = embed(query);
    Instant now = clock.instant();

    List<SearchHit> candidates =
        storage("recall", () -> vectorStore.knnSearch(vector, limit, filter));

    // Stable sort: equal scores keep ascending-distance order
    List<RecalledMemory> ranked =
        candidates.stream()
            .map(
                hit ->
                    new RecalledMemory(
                        hit.record(),
                        hit.similarity(),
                        rankingEngine.finalScore(
                            hit.similarity(),
                            hit.record().getCreatedAt(),
                            hit.record().getImportance(),
                            hit.record().getAccessCount(),
                            now)))
            .sorted(Comparator.comparingDouble(RecalledMemory::score).reversed())
            .limit(limit)
            .toList();

    if (ranked.isEmpty()) {
      return ranked;
    }

    List<String> ids = ranked.stream().map(m -> m.record().getId()).toList();
    storage(
        "recall",
        () -> {
          vectorStore.recordAccess(ids, now);
          return null;
        });
    for (RecalledMemory memory : ranked) {
      memory.record().setAccessCount(memory.record().getAccessCount() + 1);
      memory.record().setLastAccessedAt(now);
    }

    meterRegistry.counter("vault.recall.returned").increment(ranked.size());
    log.debug("Recalled {} of {} candidates", ranked.size(), candidates.size());
    return ranked;
  }

  @Override
  public boolean forget(String memoryId) {
    if (memoryId == null || memoryId.isBlank()) {
      return false;
    }
    boolean deleted = storage("forget", () -> vectorStore.deleteById(memoryId));
    if (deleted) {
      meterRegistry.counter("vault.forget.count").increment();
    }
    return deleted;
  }

  @Override
  public Optional<MemoryRecord> forgetByQuery(String query) {
    if (query == null || query.isBlank()) {
      return Optional.empty();
    }
    float[] vector = embed(query);
    return storage(
        "forget",
        () -> {
          List<SearchHit> hits = vectorStore.knnSearch(vector, 1, MemoryFilter.none());
          if (hits.isEmpty()) {
            return Optional.<MemoryRecord>empty();
          }
          MemoryRecord nearest = hits.get(0).record();
          if (!vectorStore.deleteById(nearest.getId())) {
            return Optional.<MemoryRecord>empty();
          }
          meterRegistry.counter("vault.forget.count").increment();
          return Optional.of(nearest);
        });
  }

  @Override
  public MemoryRecord getMemory(String memoryId) {
    return storage("get", () -> vectorStore.findById(memoryId))
        .orElseThrow(() -> new MemoryNotFoundException(memoryId));
  }

  @Override
  public List<MemoryRecord> list(int limit, MemoryCategory category) {
    return storage("list", () -> vectorStore.listActive(limit, category));
  }

  @Override
  public VaultStats stats() {
    return storage("stats", vectorStore::stats);
  }

  @Override
  public List<ExportedMemory> exportMemories() {
    return storage("export", vectorStore::exportAll).stream()
        .map(ExportedMemory::fromRecord)
        .toList();
  }

  @Override
  @Timed(value = "vault.import", description = "Time to import memories")
  public ImportResult importMemories(List<ExportedMemory> memories) {
    if (memories == null || memories.isEmpty()) {
      return new ImportResult(0, 0);
    }
    requireEmbedder();

    List<ExportedMemory> accepted = new ArrayList<>();
    List<String> texts = new ArrayList<>();
    Set<String> seenIds = new HashSet<>();
    int skipped = 0;
    for (ExportedMemory row : memories) {
      String text = importableText(row);
      if (text == null || (row.getId() != null && !seenIds.add(row.getId()))) {
        skipped++;
      } else {
        accepted.add(row);
        texts.add(text);
      }
    }

    // Independent texts: request every embedding up front, insert one at a time afterwards
    List<CompletableFuture<float[]>> vectors = texts.stream().map(embedder::embed).toList();

    int imported = 0;
    for (int i = 0; i < accepted.size(); i++) {
      ExportedMemory row = accepted.get(i);
      float[] vector = EmbeddingFutures.await(vectors.get(i));
      MemoryRecord record =
          MemoryRecord.builder()
              .id(row.getId() != null ? row.getId() : UUID.randomUUID().toString())
              .text(texts.get(i))
              .category(row.getCategory() != null ? row.getCategory() : MemoryCategory.OTHER)
              .importance(
                  row.getImportance() != null
                      ? row.getImportance()
                      : MemoryRecord.DEFAULT_IMPORTANCE)
              .namespace(
                  row.getNamespace() != null ? row.getNamespace() : MemoryRecord.DEFAULT_NAMESPACE)
              .agentId(row.getAgentId())
              .metadata(row.getMetadata())
              .createdAt(row.getCreatedAt())
              .build();
      storage("import", () -> vectorStore.insert(record, vector));
      imported++;
    }

    log.info("Imported {} memories, skipped {}", imported, skipped);
    meterRegistry.counter("vault.import.count").increment(imported);
    return new ImportResult(imported, skipped);
  }

  /** Cleaned text for an importable row, or null when the row must be skipped. */
  private String importableText(ExportedMemory row) {
    if (row.getText() == null || row.getText().isBlank()) {
      return null;
    }
    if (row.getConsolidatedInto() != null) {
      log.debug("Skipping consolidated memory {} on import", row.getId());
      return null;
    }
    if (row.getImportance() != null
        && (row.getImportance() < 0f || row.getImportance() > 1f)) {
      log.warn("Skipping memory {} on import: importance {}", row.getId(), row.getImportance());
      return null;
    }
    if (row.getId() != null
        && storage("import", () -> vectorStore.findById(row.getId())).isPresent()) {
      log.debug("Skipping memory {} on import: id already present", row.getId());
      return null;
    }
    SanitizedText sanitized = sanitizer.sanitize(row.getText());
    if (sanitized.flagged() || sanitized.cleanedText().isEmpty()) {
      log.warn("Skipping memory {} on import: rejected by sanitizer", row.getId());
      return null;
    }
    return sanitized.cleanedText();
  }

  @Override
  public String buildMemoryContext(List<RecalledMemory> memories) {
    if (memories == null || memories.isEmpty()) {
      return "";
    }
    StringBuilder context = new StringBuilder();
    context.append(CONTEXT_OPEN_TAG).append('\n');
    for (RecalledMemory memory : memories) {
      context
          .append("- [")
          .append(memory.record().getCategory().wireName())
          .append("] ")
          .append(memory.record().getText())
          .append('\n');
    }
    context.append(CONTEXT_CLOSE_TAG);
    return context.toString();
  }

  private Embedder requireEmbedder() {
    if (embedder == null || !embedder.isAvailable()) {
      throw new EmbedderNotConfiguredException();
    }
    return embedder;
  }

  /** Embeds outside of any transaction; callers open transactions only afterwards. */
  private float[] embed(String text) {
    return EmbeddingFutures.await(requireEmbedder().embed(text));
  }

  private <T> T storage(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException | TransactionException e) {
      log.error("Storage failure during {}: {}", operation, e.getMessage(), e);
      meterRegistry.counter("vault.storage.errors", "operation", operation).increment();
      // Constraint and mapping failures fail again on retry
      boolean retryable = !(e instanceof NonTransientDataAccessException);
      throw new VaultStorageException("Storage failure during " + operation, e, retryable);
    }
  }

  private static String preview(String text, int max) {
    return text.length() <= max ? text : text.substring(0, max) + "...";
  }
}
