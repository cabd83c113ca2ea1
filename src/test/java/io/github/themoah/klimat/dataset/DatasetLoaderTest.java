package io.github.themoah.klimat.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.klimat.config.AnalysisConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for DatasetLoader.
 */
public class DatasetLoaderTest {

  @Test
  void fromConfig_withoutPath_generatesSyntheticData() {
    AnalysisConfig config = new AnalysisConfig(Optional.empty(), 1, 5L, 30, 2, 60_000L);
    DatasetLoader loader = DatasetLoader.fromConfig(config);

    assertEquals(15 * 365, loader.get().size());
    assertEquals("synthetic(years=1, seed=5)", loader.describe());
  }

  @Test
  void fromConfig_withPath_readsFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("data.csv");
    Files.writeString(file, "city,timestamp,temperature,season\nOslo,2021-01-01,-3.5,winter\nOslo,2021-01-02,-4.0,winter\n");
    AnalysisConfig config = new AnalysisConfig(Optional.of(file), 1, 5L, 30, 2, 60_000L);

    DatasetLoader loader = DatasetLoader.fromConfig(config);

    assertEquals(2, loader.get().size());
    assertTrue(loader.describe().startsWith("file "));
  }

  @Test
  void fromFile_missingFile_throwsUnchecked(@TempDir Path dir) {
    DatasetLoader loader = DatasetLoader.fromFile(dir.resolve("missing.csv"));

    assertThrows(UncheckedIOException.class, loader::get);
  }
}
