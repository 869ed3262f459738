package com.flamingo.ai.memoryvault.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.memoryvault.service.vault.SaveResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a save request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SaveMemoryResponse {

  private SaveResult.Status status;
  private String message;
  private MemoryResponse memory;

  /** Nearest existing memory when the text was a duplicate. */
  private MemoryResponse duplicateOf;

  public static SaveMemoryResponse fromResult(SaveResult result) {
    return SaveMemoryResponse.builder()
        .status(result.status())
        .message(result.message())
        .memory(result.record() != null ? MemoryResponse.fromEntity(result.record()) : null)
        .duplicateOf(
            result.duplicateOf() != null
                ? MemoryResponse.builder()
                    .id(result.duplicateOf().id())
                    .text(result.duplicateOf().record().getText())
                    .category(result.duplicateOf().record().getCategory())
                    .similarity(result.duplicateOf().similarity())
                    .build()
                : null)
        .build();
  }
}
