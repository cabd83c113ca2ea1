package io.github.themoah.klimat.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private MicrometerConfig() {}

  /**
   * Creates a Prometheus meter registry, scraped through the HTTP API.
   */
  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an in-memory registry, used by the benchmark and when no exporter is wanted.
   */
  public static MeterRegistry createSimpleRegistry() {
    log.info("Creating in-memory meter registry");
    return new SimpleMeterRegistry();
  }

  /**
   * Creates a meter registry based on the configured reporter type.
   *
   * @param config the metrics configuration
   * @return the configured MeterRegistry; an in-memory registry when reporting is disabled or unknown
   */
  public static MeterRegistry createRegistry(MetricsConfig config) {
    String reporterType = config.reporterType() == null ? "none" : config.reporterType().toLowerCase();

    MeterRegistry registry = switch (reporterType) {
      case "prometheus" -> createPrometheusRegistry();
      case "simple", "none" -> createSimpleRegistry();
      default -> {
        log.warn("Unknown reporter type: {}, falling back to in-memory registry", reporterType);
        yield createSimpleRegistry();
      }
    };

    if (config.jvmMetricsEnabled()) {
      bindJvmMetrics(registry);
    }
    return registry;
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   *
   * @param registry the meter registry to bind JVM metrics to
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
