package com.flamingo.ai.memoryvault.service.consolidation;

import com.flamingo.ai.memoryvault.config.VaultConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs consolidation on a fixed delay and on demand, never more than one pass at a time.
 * Scheduled and manual runs share the same guard.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConsolidationScheduler {

  private final ConsolidationService consolidationService;
  private final VaultConfig vaultConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicBoolean running = new AtomicBoolean(false);

  @Scheduled(
      fixedDelayString = "${vault.consolidation.interval-minutes:360}",
      initialDelayString = "${vault.consolidation.interval-minutes:360}",
      timeUnit = TimeUnit.MINUTES)
  public void scheduledRun() {
    if (!vaultConfig.getConsolidation().isEnabled()) {
      return;
    }
    try {
      if (triggerNow().isEmpty()) {
        log.debug("Scheduled consolidation skipped, a pass is already running");
      }
    } catch (RuntimeException e) {
      meterRegistry.counter("vault.consolidation.failures").increment();
      log.error("Scheduled consolidation failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Runs a consolidation pass on the calling thread.
   *
   * @return the number of merges, or empty when another pass is in progress
   */
  public OptionalInt triggerNow() {
    if (!running.compareAndSet(false, true)) {
      return OptionalInt.empty();
    }
    try {
      return OptionalInt.of(consolidationService.runConsolidation());
    } finally {
      running.set(false);
    }
  }
}
