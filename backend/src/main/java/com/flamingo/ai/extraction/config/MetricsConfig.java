package com.flamingo.ai.extraction.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics setup. Extraction, discovery and API error meters all carry an {@code application} tag
 * so they can be told apart from other services on a shared registry.
 */
@Configuration
public class MetricsConfig {

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
      @Value("${spring.application.name:structured-extraction}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }

  /** Backs {@code @Timed} on the extraction service entry points. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
