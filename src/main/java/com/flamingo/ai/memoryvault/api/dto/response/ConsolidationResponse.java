package com.flamingo.ai.memoryvault.api.dto.response;

/** Result of a manually triggered consolidation pass. */
public record ConsolidationResponse(int merged) {}
