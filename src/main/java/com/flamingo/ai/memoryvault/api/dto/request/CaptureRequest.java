package com.flamingo.ai.memoryvault.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The user messages of one conversation turn. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CaptureRequest {

  @NotNull(message = "Messages are required")
  private List<String> messages;
}
