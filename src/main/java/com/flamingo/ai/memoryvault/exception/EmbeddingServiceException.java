package com.flamingo.ai.memoryvault.exception;

/** Exception thrown when the embedding provider fails or returns an unusable vector. */
public class EmbeddingServiceException extends RuntimeException {

  private final String userMessage;

  public EmbeddingServiceException(String message) {
    super(message);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public EmbeddingServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Embedding service is temporarily unavailable. Please try again later.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
