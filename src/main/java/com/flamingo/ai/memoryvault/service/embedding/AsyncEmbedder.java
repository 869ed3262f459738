package com.flamingo.ai.memoryvault.service.embedding;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** {@link Embedder} that runs {@link EmbeddingService} calls on the embedding executor. */
@Component
public class AsyncEmbedder implements Embedder {

  private final EmbeddingService embeddingService;
  private final Executor executor;

  public AsyncEmbedder(
      EmbeddingService embeddingService, @Qualifier("embeddingExecutor") Executor executor) {
    this.embeddingService = embeddingService;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<float[]> embed(String text) {
    return CompletableFuture.supplyAsync(() -> embeddingService.embedText(text), executor);
  }

  @Override
  public boolean isAvailable() {
    return embeddingService.isAvailable();
  }
}
