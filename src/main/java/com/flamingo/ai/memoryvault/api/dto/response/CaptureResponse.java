package com.flamingo.ai.memoryvault.api.dto.response;

/** Number of memories captured from a turn. */
public record CaptureResponse(int captured) {}
