package io.github.themoah.klimat.benchmark;

import io.github.themoah.klimat.config.AnalysisConfig;
import io.github.themoah.klimat.config.VertxConfig;
import io.github.themoah.klimat.dataset.DatasetLoader;
import io.github.themoah.klimat.metrics.AnalysisMetrics;
import io.github.themoah.klimat.metrics.MicrometerConfig;
import io.github.themoah.klimat.model.ObservationSnapshot;
import io.github.themoah.klimat.scheduler.ExecutionScheduler;
import io.vertx.core.Vertx;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point comparing sequential and parallel analysis on the configured dataset.
 * Takes no arguments; exits with status 1 on failure.
 */
public class BenchmarkLauncher {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkLauncher.class);

  public static void main(String[] args) {
    VertxConfig.useSlf4jLogging();
    System.exit(run(AnalysisConfig.fromEnvironment()));
  }

  /**
   * Runs the benchmark and returns the process exit status.
   */
  static int run(AnalysisConfig config) {
    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions(config));
    try {
      DatasetLoader loader = DatasetLoader.fromConfig(config);
      log.info("Loading dataset: {}", loader.describe());
      ObservationSnapshot snapshot = loader.get();

      BenchmarkHarness harness = new BenchmarkHarness(
        new ExecutionScheduler(vertx, config),
        new AnalysisMetrics(MicrometerConfig.createSimpleRegistry()));
      BenchmarkReport report = harness.run(snapshot, config.workerCount());

      System.out.println(report.summary());
      return 0;
    } catch (RuntimeException e) {
      log.error("Benchmark failed", e);
      System.err.println("Benchmark failed: " + e.getMessage());
      return 1;
    } finally {
      closeQuietly(vertx);
    }
  }

  private static void closeQuietly(Vertx vertx) {
    try {
      vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    } catch (Exception e) {
      log.warn("Failed to close Vert.x cleanly: {}", e.getMessage());
    }
  }
}
