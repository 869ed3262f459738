package com.flamingo.ai.memoryvault.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.memoryvault.domain.entity.MemoryRecord;
import com.flamingo.ai.memoryvault.domain.enums.MemoryCategory;
import com.flamingo.ai.memoryvault.service.vault.RecalledMemory;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for memory data. Similarity and score are only present on recall results. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MemoryResponse {

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
  private Double similarity;
  private Double score;

  /** Creates a MemoryResponse from a MemoryRecord entity. */
  public static MemoryResponse fromEntity(MemoryRecord record) {
    return MemoryResponse.builder()
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

  public static MemoryResponse fromRecall(RecalledMemory memory) {
    MemoryResponse response = fromEntity(memory.record());
    response.setSimilarity(memory.similarity());
    response.setScore(memory.score());
    return response;
  }
}
