package io.github.themoah.klimat.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for dataset loading and analysis execution.
 *
 * @param datasetPath CSV dataset to load; empty to generate the synthetic dataset
 * @param syntheticYears number of years the synthetic dataset covers (default 10)
 * @param syntheticSeed random seed of the synthetic dataset (default 42)
 * @param rollingWindow rows in the rolling average window (default 30)
 * @param workerCount worker threads for parallel detection (default: available processors)
 * @param workerTimeoutMs upper bound for one parallel detection batch (default 60000, 0 disables)
 */
public record AnalysisConfig(
  Optional<Path> datasetPath,
  int syntheticYears,
  long syntheticSeed,
  int rollingWindow,
  int workerCount,
  long workerTimeoutMs
) {

  private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

  public static final int DEFAULT_SYNTHETIC_YEARS = 10;
  public static final long DEFAULT_SYNTHETIC_SEED = 42L;
  public static final int DEFAULT_ROLLING_WINDOW = 30;
  public static final long DEFAULT_WORKER_TIMEOUT_MS = 60_000L;

  /**
   * Returns the defaults, with no dataset file configured.
   */
  public static AnalysisConfig defaults() {
    return new AnalysisConfig(
      Optional.empty(),
      DEFAULT_SYNTHETIC_YEARS,
      DEFAULT_SYNTHETIC_SEED,
      DEFAULT_ROLLING_WINDOW,
      defaultWorkerCount(),
      DEFAULT_WORKER_TIMEOUT_MS
    );
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>KLIMAT_DATASET_PATH - CSV file with city,timestamp,temperature,season columns (default: synthetic)</li>
   *   <li>KLIMAT_SYNTHETIC_YEARS - Years of generated daily data (default: 10)</li>
   *   <li>KLIMAT_SYNTHETIC_SEED - Seed of the generated data (default: 42)</li>
   *   <li>KLIMAT_ROLLING_WINDOW - Rows in the rolling average window (default: 30)</li>
   *   <li>KLIMAT_WORKER_COUNT - Workers for parallel detection (default: available processors)</li>
   *   <li>KLIMAT_WORKER_TIMEOUT_MS - Timeout of a parallel detection batch (default: 60000)</li>
   * </ul>
   */
  public static AnalysisConfig fromEnvironment() {
    return from(System.getenv());
  }

  static AnalysisConfig from(Map<String, String> env) {
    Optional<Path> datasetPath = Optional.ofNullable(Env.getString(env, "KLIMAT_DATASET_PATH", null))
      .map(Path::of);
    int years = Env.getIntAtLeast(env, "KLIMAT_SYNTHETIC_YEARS", 1, DEFAULT_SYNTHETIC_YEARS);
    long seed = Env.getLong(env, "KLIMAT_SYNTHETIC_SEED", DEFAULT_SYNTHETIC_SEED);
    int window = Env.getIntAtLeast(env, "KLIMAT_ROLLING_WINDOW", 1, DEFAULT_ROLLING_WINDOW);
    int workers = Env.getIntAtLeast(env, "KLIMAT_WORKER_COUNT", 1, defaultWorkerCount());
    long timeoutMs = Env.getLong(env, "KLIMAT_WORKER_TIMEOUT_MS", DEFAULT_WORKER_TIMEOUT_MS);

    AnalysisConfig config = new AnalysisConfig(datasetPath, years, seed, window, workers, timeoutMs);
    log.info("Analysis config: dataset={}, syntheticYears={}, rollingWindow={}, workerCount={}, workerTimeoutMs={}",
      datasetPath.map(Path::toString).orElse("<synthetic>"), years, window, workers, timeoutMs);

    return config;
  }

  public static int defaultWorkerCount() {
    return Runtime.getRuntime().availableProcessors();
  }
}
