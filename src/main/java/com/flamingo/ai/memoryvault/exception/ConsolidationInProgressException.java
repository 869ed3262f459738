package com.flamingo.ai.memoryvault.exception;

/** Thrown when a consolidation run is requested while another one is still running. */
public class ConsolidationInProgressException extends RuntimeException {

  public ConsolidationInProgressException() {
    super("A consolidation run is already in progress");
  }
}
