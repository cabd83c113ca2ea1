package io.github.themoah.klimat.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for MetricsConfig and MicrometerConfig.
 */
public class MetricsConfigTest {

  @Test
  void from_defaults() {
    MetricsConfig config = MetricsConfig.from(Map.of());

    assertEquals("prometheus", config.reporterType());
    assertFalse(config.jvmMetricsEnabled());
    assertTrue(config.isEnabled());
  }

  @Test
  void from_disabled() {
    MetricsConfig config = MetricsConfig.from(Map.of("METRICS_REPORTER", "NONE", "METRICS_JVM_ENABLED", "true"));

    assertFalse(config.isEnabled());
    assertTrue(config.jvmMetricsEnabled());
  }

  @Test
  void createRegistry_byReporterType() {
    assertInstanceOf(PrometheusMeterRegistry.class,
        MicrometerConfig.createRegistry(new MetricsConfig("prometheus", false)));
    assertInstanceOf(SimpleMeterRegistry.class,
        MicrometerConfig.createRegistry(new MetricsConfig("simple", false)));
    assertInstanceOf(SimpleMeterRegistry.class,
        MicrometerConfig.createRegistry(new MetricsConfig("statsd", false)));
  }

  @Test
  void createRegistry_bindsJvmMetrics() {
    MeterRegistry registry = MicrometerConfig.createRegistry(new MetricsConfig("simple", true));

    assertTrue(registry.find("jvm.memory.used").gauges().size() > 0);
  }
}
