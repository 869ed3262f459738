package com.flamingo.ai.memoryvault.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(MemoryNotFoundException.class)
  public ResponseEntity<ApiError> handleMemoryNotFound(
      MemoryNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("memory_not_found");
    String errorId = generateErrorId();
    log.warn("Memory not found [{}]: {}", errorId, ex.getMemoryId());

    return error(
        HttpStatus.NOT_FOUND, errorId, ApiError.MEMORY_NOT_FOUND, "Memory not found", request);
  }

  @ExceptionHandler(DimensionMismatchException.class)
  public ResponseEntity<ApiError> handleDimensionMismatch(
      DimensionMismatchException ex, HttpServletRequest request) {

    incrementErrorCounter("dimension_mismatch");
    String errorId = generateErrorId();
    log.error("Dimension mismatch [{}]: {}", errorId, ex.getMessage());

    return error(
        HttpStatus.CONFLICT, errorId, ApiError.DIMENSION_MISMATCH, ex.getUserMessage(), request);
  }

  @ExceptionHandler(ConsolidationInProgressException.class)
  public ResponseEntity<ApiError> handleConsolidationInProgress(
      ConsolidationInProgressException ex, HttpServletRequest request) {

    incrementErrorCounter("consolidation_in_progress");
    String errorId = generateErrorId();
    log.info("Consolidation request refused [{}]: a pass is already running", errorId);

    return error(
        HttpStatus.CONFLICT,
        errorId,
        ApiError.CONSOLIDATION_IN_PROGRESS,
        "A consolidation pass is already running",
        request);
  }

  @ExceptionHandler(EmbedderNotConfiguredException.class)
  public ResponseEntity<ApiError> handleEmbedderNotConfigured(
      EmbedderNotConfiguredException ex, HttpServletRequest request) {

    incrementErrorCounter("embedder_not_configured");
    String errorId = generateErrorId();
    log.warn("Embedder not configured [{}]", errorId);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDER_NOT_CONFIGURED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(EmbeddingServiceException.class)
  public ResponseEntity<ApiError> handleEmbeddingService(
      EmbeddingServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_error");
    String errorId = generateErrorId();
    log.error("Embedding service error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(VaultStorageException.class)
  public ResponseEntity<ApiError> handleStorage(
      VaultStorageException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.isRetryable() ? "storage_busy" : "storage_error");
    String errorId = generateErrorId();
    log.error("Storage error [{}]: {}", errorId, ex.getMessage(), ex);

    if (ex.isRetryable()) {
      return error(
          HttpStatus.SERVICE_UNAVAILABLE,
          errorId,
          ApiError.STORAGE_UNAVAILABLE,
          ex.getUserMessage(),
          request);
    }
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.STORAGE_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("bad_request");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
