package com.flamingo.ai.memoryvault.exception;

/** Exception thrown when a memory is not found. */
public class MemoryNotFoundException extends RuntimeException {

  private final String memoryId;

  public MemoryNotFoundException(String memoryId) {
    super("Memory not found with ID: " + memoryId);
    this.memoryId = memoryId;
  }

  public String getMemoryId() {
    return memoryId;
  }
}
