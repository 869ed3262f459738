package com.flamingo.ai.memoryvault.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String MEMORY_NOT_FOUND = "MEMORY_001";
  public static final String DIMENSION_MISMATCH = "VAULT_001";
  public static final String STORAGE_UNAVAILABLE = "VAULT_002";
  public static final String STORAGE_ERROR = "VAULT_003";
  public static final String CONSOLIDATION_IN_PROGRESS = "VAULT_004";
  public static final String EMBEDDER_NOT_CONFIGURED = "EMBEDDING_001";
  public static final String EMBEDDING_FAILED = "EMBEDDING_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
