package com.flamingo.ai.memoryvault.service.vault;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import com.flamingo.ai.memoryvault.service.store.MemoryFilter;
import com.flamingo.ai.memoryvault.service.store.VaultStats;
import java.util.List;
import java.util.Optional;

/** Saves, recalls and forgets memories on top of the vector store and the embedder. */
public interface VaultService {

  /**
   * Validates, sanitizes, embeds and stores a memory unless a near-identical one exists.
   *
   * @param text the memory text
   * @param options optional category, importance and partitioning; null for defaults
   * @return the outcome; rejections and duplicates insert nothing
   * @throws com.flamingo.ai.memoryvault.exception.EmbedderNotConfiguredException if no embedder is
   *     available
   */
  SaveResult save(String text, SaveOptions options);

  /**
   * Finds the memories most relevant to a query, ranked by similarity, recency, importance and
   * access count. The returned records have their access count bumped.
   *
   * @param query what to search for
   * @param limit maximum number of results
   * @param filter optional category/namespace/agent restriction, may be null
   * @return at most {@code limit} memories by descending score
   */
  List<RecalledMemory> recall(String query, int limit, MemoryFilter filter);

  /**
   * Hard-deletes a memory by id.
   *
   * @return false when no such memory exists
   */
  boolean forget(String memoryId);

  /**
   * Hard-deletes the active memory nearest to the query.
   *
   * @return the deleted memory, or empty when nothing matched
   */
  Optional<MemoryRecord> forgetByQuery(String query);

  MemoryRecord getMemory(String memoryId);

  List<MemoryRecord> list(int limit, MemoryCategory category);

  VaultStats stats();

  /** All memories, including consolidated ones, oldest first. */
  List<ExportedMemory> exportMemories();

  /** Embeds and inserts exported memories, generating ids where absent. */
  ImportResult importMemories(List<ExportedMemory> memories);

  /**
   * Formats recalled memories as a context block for a prompt. The block's marker is recognised by
   * the capture evaluator, so injected memories are never captured again.
   *
   * @return the block, or an empty string when there is nothing to inject
   */
  String buildMemoryContext(List<RecalledMemory> memories);
}
