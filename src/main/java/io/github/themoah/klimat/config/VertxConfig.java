package io.github.themoah.klimat.config;

import io.vertx.core.VertxOptions;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x instance options shared by the server and benchmark launchers.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);

  private static final String LOGGER_DELEGATE_PROPERTY = "vertx.logger-delegate-factory-class-name";
  private static final String SLF4J_DELEGATE = "io.vertx.core.logging.SLF4JLogDelegateFactory";

  private VertxConfig() {}

  /**
   * Routes Vert.x internal logging through SLF4J unless already configured.
   * Must run before the first Vert.x class is initialized.
   */
  public static void useSlf4jLogging() {
    if (System.getProperty(LOGGER_DELEGATE_PROPERTY) == null) {
      System.setProperty(LOGGER_DELEGATE_PROPERTY, SLF4J_DELEGATE);
    }
  }

  /**
   * Creates Vert.x options. Detection runs on dedicated worker executors sized per run,
   * so the default worker pool only serves blocking I/O such as dataset loading.
   *
   * @param analysisConfig the analysis configuration
   * @return configured options
   */
  public static VertxOptions createVertxOptions(AnalysisConfig analysisConfig) {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    if (analysisConfig.workerTimeoutMs() > 0) {
      options.setMaxWorkerExecuteTime(analysisConfig.workerTimeoutMs());
      options.setMaxWorkerExecuteTimeUnit(TimeUnit.MILLISECONDS);
    }
    log.info("Vert.x options: eventLoopPoolSize={}, workerPoolSize={}",
      options.getEventLoopPoolSize(), options.getWorkerPoolSize());
    return options;
  }
}
