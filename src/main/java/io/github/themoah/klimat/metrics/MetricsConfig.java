package io.github.themoah.klimat.metrics;

import io.github.themoah.klimat.config.Env;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for metrics reporting.
 *
 * @param reporterType registry backend: "prometheus", "simple" or "none"
 * @param jvmMetricsEnabled whether JVM memory, GC, thread and CPU metrics are bound
 */
public record MetricsConfig(String reporterType, boolean jvmMetricsEnabled) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  public boolean isEnabled() {
    return !"none".equalsIgnoreCase(reporterType);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_REPORTER - prometheus, simple or none (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: false)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    return from(System.getenv());
  }

  static MetricsConfig from(Map<String, String> env) {
    String reporter = Env.getString(env, "METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = Env.getBoolean(env, "METRICS_JVM_ENABLED", false);

    log.info("Metrics config: reporter={}, jvmMetricsEnabled={}", reporter, jvm);
    return new MetricsConfig(reporter, jvm);
  }
}
