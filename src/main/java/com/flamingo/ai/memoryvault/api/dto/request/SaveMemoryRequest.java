package com.flamingo.ai.memoryvault.api.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for saving a memory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaveMemoryRequest {

  @NotBlank(message = "Text is required")
  private String text;

  @Pattern(
      regexp = "^(?i)(preference|fact|decision|entity|procedure|context|other)$",
      message = "Category must be a known memory category")
  private String category;

  @DecimalMin(value = "0.0", message = "Importance must be at least 0.0")
  @DecimalMax(value = "1.0", message = "Importance must be at most 1.0")
  private Float importance;

  @Size(max = 128, message = "Namespace must not exceed 128 characters")
  private String namespace;

  @Size(max = 128, message = "Agent id must not exceed 128 characters")
  private String agentId;

  private Map<String, Object> metadata;
}
