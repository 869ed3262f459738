package com.flamingo.ai.memoryvault.service.embedding;

import com.flamingo.ai.memoryvault.exception.EmbedderNotConfiguredException;
import com.flamingo.ai.memoryvault.exception.EmbeddingServiceException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** Waits for embedder results and unwraps their failures. */
public final class EmbeddingFutures {

  private EmbeddingFutures() {}

  /**
   * Blocks until the embedding is available. Domain exceptions raised by the embedder are rethrown
   * as-is; anything else becomes an {@link EmbeddingServiceException}.
   */
  public static float[] await(CompletableFuture<float[]> future) {
    float[] vector;
    try {
      vector = future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof EmbeddingServiceException
          || cause instanceof EmbedderNotConfiguredException) {
        throw (RuntimeException) cause;
      }
      throw new EmbeddingServiceException("Embedding request failed: " + cause.getMessage(), cause);
    }
    if (vector == null || vector.length == 0) {
      throw new EmbeddingServiceException("Embedding provider returned an empty vector");
    }
    return vector;
  }
}
