package com.flamingo.ai.memoryvault.exception;

/** Exception thrown when a write or read against the vault database fails. */
public class VaultStorageException extends RuntimeException {

  private final boolean retryable;

  public VaultStorageException(String message, Throwable cause) {
    this(message, cause, true);
  }

  public VaultStorageException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  /** Whether the failed operation was rolled back and may be retried as-is. */
  public boolean isRetryable() {
    return retryable;
  }

  public String getUserMessage() {
    return retryable
        ? "The memory store is busy. Please try again."
        : "The memory store could not complete the request.";
  }
}
