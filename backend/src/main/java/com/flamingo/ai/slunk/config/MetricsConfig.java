package com.flamingo.ai.slunk.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics setup. Service timers such as {@code ingestion.batch}, {@code search.hybrid} and the
 * {@code message_index.*} family come from {@code @Timed}; counters are registered where they
 * are incremented.
 */
@Configuration
public class MetricsConfig {

  /** Backs the {@code @Timed} annotations on the ingestion and search services. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application name. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
      @Value("${spring.application.name:slunk}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
