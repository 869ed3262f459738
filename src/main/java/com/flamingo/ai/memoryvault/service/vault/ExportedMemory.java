package com.flamingo.ai.memoryvault.service.vault;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Portable form of a memory record used by export and import. Vectors are not exported. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportedMemory {

  private String id;
  private String text;
  private MemoryCategory category;
  private Float importance;
  private Integer accessCount;
  private Instant createdAt;
  private Instant updatedAt;
  private Instant lastAccessedAt;
  private String consolidatedInto;
  private String namespace;
  private String agentId;
  private Map<String, Object> metadata;

  public static ExportedMemory fromRecord(MemoryRecord record) {
    return ExportedMemory.builder()
        .id(record.getId())
        .text(record.getText())
        .category(record.getCategory())
        .importance(record.getImportance())
        .accessCount(record.getAccessCount())
        .createdAt(record.getCreatedAt())
        .updatedAt(record.getUpdatedAt())
        .lastAccessedAt(record.getLastAccessedAt())
        .consolidatedInto(record.getConsolidatedInto())
        .namespace(record.getNamespace())
        .agentId(record.getAgentId())
        .metadata(record.getMetadata())
        .build();
  }
}
