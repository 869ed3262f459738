package com.flamingo.ai.memoryvault.service.vault;

import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import java.util.Map;
import lombok.Builder;

/**
 * Optional attributes for a saved memory. Null components fall back to defaults: category other,
 * importance 0.7, namespace "default".
 */
@Builder
public record SaveOptions(
    MemoryCategory category,
    Float importance,
    String namespace,
    String agentId,
    Map<String, Object> metadata) {

  public static SaveOptions defaults() {
    return SaveOptions.builder().build();
  }
}
