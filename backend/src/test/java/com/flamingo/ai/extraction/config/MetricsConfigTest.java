package com.flamingo.ai.extraction.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;

@DisplayName("MetricsConfig Tests")
class MetricsConfigTest {

  @Test
  @DisplayName("Should tag every meter with the application name")
  void shouldApplyApplicationTag() {
    MeterRegistry registry = new SimpleMeterRegistry();
    MeterRegistryCustomizer<MeterRegistry> customizer =
        new MetricsConfig().applicationTagCustomizer("structured-extraction");

    customizer.customize(registry);
    registry.counter("discovery.passes").increment();

    Counter counter = registry.find("discovery.passes").counter();
    assertThat(counter).isNotNull();
    assertThat(counter.getId().getTag("application")).isEqualTo("structured-extraction");
  }
}
