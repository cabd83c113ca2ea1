package io.github.themoah.klimat.dataset;

import io.github.themoah.klimat.config.AnalysisConfig;
import io.github.themoah.klimat.model.ObservationSnapshot;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the fixed dataset an entry point analyzes: a CSV file when one is configured,
 * otherwise the synthetic history.
 */
public final class DatasetLoader implements Supplier<ObservationSnapshot> {

  private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

  private final Path datasetPath;
  private final int syntheticYears;
  private final long syntheticSeed;

  private DatasetLoader(Path datasetPath, int syntheticYears, long syntheticSeed) {
    this.datasetPath = datasetPath;
    this.syntheticYears = syntheticYears;
    this.syntheticSeed = syntheticSeed;
  }

  public static DatasetLoader fromConfig(AnalysisConfig config) {
    return new DatasetLoader(config.datasetPath().orElse(null), config.syntheticYears(), config.syntheticSeed());
  }

  public static DatasetLoader fromFile(Path path) {
    return new DatasetLoader(path, AnalysisConfig.DEFAULT_SYNTHETIC_YEARS, AnalysisConfig.DEFAULT_SYNTHETIC_SEED);
  }

  public static DatasetLoader synthetic(int years, long seed) {
    return new DatasetLoader(null, years, seed);
  }

  /**
   * Loads the dataset. Blocking.
   *
   * @return an immutable snapshot
   * @throws UncheckedIOException if the configured file cannot be read
   * @throws io.github.themoah.klimat.error.InputSchemaException if the file violates the schema
   */
  @Override
  public ObservationSnapshot get() {
    if (datasetPath == null) {
      log.info("No dataset file configured, generating {} years of synthetic data", syntheticYears);
      return new SyntheticDatasetGenerator(syntheticSeed).generate(syntheticYears);
    }
    try {
      return ObservationCsvLoader.load(datasetPath);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read dataset " + datasetPath, e);
    }
  }

  public String describe() {
    return datasetPath != null
      ? "file " + datasetPath
      : "synthetic(years=" + syntheticYears + ", seed=" + syntheticSeed + ")";
  }
}
