package com.flamingo.ai.memoryvault.service.store;

import java.util.Map;

/**
 * Record counts for the whole vault.
 *
 * @param total all records, active and consolidated
 * @param active records not merged into a successor
 * @param consolidated tombstoned records
 * @param categories active record count per category name
 */
public record VaultStats(
    long total, long active, long consolidated, Map<String, Long> categories) {}
