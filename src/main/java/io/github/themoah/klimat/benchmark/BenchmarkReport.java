package io.github.themoah.klimat.benchmark;

import java.time.Duration;
import java.util.Locale;

/**
 * Timings of one sequential and one parallel run over the same snapshot.
 *
 * @param sequential wall-clock duration of the sequential run
 * @param parallel wall-clock duration of the parallel run
 * @param workerCount workers used by the parallel run
 * @param partitionCount number of (city, season) partitions analyzed
 * @param anomalyCount anomalies found (identical for both runs)
 */
public record BenchmarkReport(
  Duration sequential,
  Duration parallel,
  int workerCount,
  int partitionCount,
  int anomalyCount
) {

  /**
   * Sequential time divided by parallel time; values above 1 mean the parallel run was faster.
   */
  public double speedup() {
    long parallelNanos = Math.max(parallel.toNanos(), 1L);
    return (double) sequential.toNanos() / parallelNanos;
  }

  public String summary() {
    return String.format(Locale.ROOT,
      "Sequential: %.3f s%nParallel (%d workers): %.3f s%nSpeedup: %.2fx%nPartitions: %d, anomalies: %d",
      seconds(sequential), workerCount, seconds(parallel), speedup(), partitionCount, anomalyCount);
  }

  private static double seconds(Duration duration) {
    return duration.toNanos() / 1_000_000_000.0;
  }
}
