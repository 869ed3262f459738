package com.flamingo.ai.memoryvault.service.vault;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;

/**
 * A recall result.
 *
 * @param record the memory, with its access count already bumped
 * @param similarity cosine similarity to the query
 * @param score ranking score combining similarity, recency, importance and access count
 */
public record RecalledMemory(MemoryRecord record, double similarity, double score) {}
