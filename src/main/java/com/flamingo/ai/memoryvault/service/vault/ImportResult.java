package com.flamingo.ai.memoryvault.service.vault;

/**
 * Counts from an import.
 *
 * @param imported rows inserted
 * @param skipped rows ignored: no text, tombstoned, flagged, invalid importance, or id already
 *     present
 */
public record ImportResult(int imported, int skipped) {}
