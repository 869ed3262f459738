package com.flamingo.ai.memoryvault.service.store;

import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;

/**
 * Optional restrictions on a kNN search. Null components match everything.
 *
 * @param category only records of this category
 * @param namespace only records in this namespace
 * @param agentId only records owned by this agent
 */
public record MemoryFilter(MemoryCategory category, String namespace, String agentId) {

  private static final MemoryFilter NONE = new MemoryFilter(null, null, null);

  public static MemoryFilter none() {
    return NONE;
  }

  public static MemoryFilter category(MemoryCategory category) {
    return new MemoryFilter(category, null, null);
  }

  public boolean matches(MemoryRecord record) {
    return (category == null || category == record.getCategory())
        && (namespace == null || namespace.equals(record.getNamespace()))
        && (agentId == null || agentId.equals(record.getAgentId()));
  }
}
