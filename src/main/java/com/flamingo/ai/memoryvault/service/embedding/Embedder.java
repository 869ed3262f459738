package com.flamingo.ai.memoryvault.service.embedding;

import java.util.concurrent.CompletableFuture;

/**
 * Turns text into a vector. Implementations must return vectors of one constant dimension for the
 * lifetime of a vault.
 */
public interface Embedder {

  CompletableFuture<float[]> embed(String text);

  /** Whether an embedding provider is configured at all. */
  default boolean isAvailable() {
    return true;
  }
}
