package com.flamingo.ai.memoryvault.exception;

/** Thrown by operations that need embeddings when no embedding provider is configured. */
public class EmbedderNotConfiguredException extends RuntimeException {

  public EmbedderNotConfiguredException() {
    super("Embedding provider not configured. Set OPENAI_API_KEY or provide an Embedder bean.");
  }

  public String getUserMessage() {
    return "Memory search is unavailable: no embedding provider is configured.";
  }
}
