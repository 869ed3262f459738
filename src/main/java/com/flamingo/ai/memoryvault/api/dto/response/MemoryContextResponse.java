package com.flamingo.ai.memoryvault.api.dto.response;

import java.util.List;

/**
 * A rendered memory context block together with the memories it contains.
 *
 * @param context the block to inject into a prompt, empty when nothing was recalled
 * @param memories the recalled memories in rank order
 */
public record MemoryContextResponse(String context, List<MemoryResponse> memories) {}
