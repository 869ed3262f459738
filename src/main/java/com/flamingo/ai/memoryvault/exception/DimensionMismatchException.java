package com.flamingo.ai.memoryvault.exception;

/**
 * Thrown when a vector's dimension differs from the dimension the store was initialized with. The
 * store is left untouched; re-embedding or migrating is never attempted.
 */
public class DimensionMismatchException extends RuntimeException {

  private final int storedDimension;
  private final int requestedDimension;

  public DimensionMismatchException(int storedDimension, int requestedDimension) {
    super(
        "Embedding dimension mismatch: store has "
            + storedDimension
            + ", caller passed "
            + requestedDimension
            + ". Switch back to a "
            + storedDimension
            + "-dimension model or start a new vault to re-embed.");
    this.storedDimension = storedDimension;
    this.requestedDimension = requestedDimension;
  }

  public int getStoredDimension() {
    return storedDimension;
  }

  public int getRequestedDimension() {
    return requestedDimension;
  }

  public String getUserMessage() {
    return "The configured embedding model does not match this memory vault.";
  }
}
