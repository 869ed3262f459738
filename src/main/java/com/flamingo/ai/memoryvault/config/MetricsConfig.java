package com.flamingo.ai.memoryvault.config;

import com.flamingo.ai.memoryvault.domain.repository.MemoryRecordRepository;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Gauges for active and consolidated memory counts, sampled on scrape. */
  @Bean
  public MeterBinder vaultGauges(MemoryRecordRepository recordRepository) {
    return registry -> {
      Gauge.builder(
              "vault.memories.active",
              recordRepository,
              MemoryRecordRepository::countByConsolidatedIntoIsNull)
          .description("Memories visible to recall")
          .register(registry);
      Gauge.builder(
              "vault.memories.consolidated",
              recordRepository,
              r -> r.count() - r.countByConsolidatedIntoIsNull())
          .description("Memories merged into a successor")
          .register(registry);
    };
  }
}
