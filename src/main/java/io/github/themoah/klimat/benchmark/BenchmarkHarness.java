package io.github.themoah.klimat.benchmark;

import io.github.themoah.klimat.error.AnalysisException;
import io.github.themoah.klimat.metrics.AnalysisMetrics;
import io.github.themoah.klimat.model.AnalysisResult;
import io.github.themoah.klimat.model.ObservationSnapshot;
import io.github.themoah.klimat.scheduler.ExecutionScheduler;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Times the sequential and parallel analysis of the same snapshot.
 */
public class BenchmarkHarness {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkHarness.class);

  private final ExecutionScheduler scheduler;
  private final AnalysisMetrics metrics;

  public BenchmarkHarness(ExecutionScheduler scheduler, AnalysisMetrics metrics) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Runs the sequential path, then the parallel path, each end to end.
   *
   * @param snapshot the dataset, shared unchanged by both runs
   * @param workerCount workers for the parallel run
   * @return both timings and the speedup
   * @throws AnalysisException if either run fails, or the two runs disagree
   */
  public BenchmarkReport run(ObservationSnapshot snapshot, int workerCount) {
    log.info("Benchmarking {} observations, parallel run on {} workers", snapshot.size(), workerCount);

    long start = System.nanoTime();
    AnalysisResult sequential = scheduler.runSequential(snapshot);
    Duration sequentialTime = Duration.ofNanos(System.nanoTime() - start);
    metrics.recordDuration("sequential", sequentialTime);
    log.info("Sequential run took {} ms", sequentialTime.toMillis());

    start = System.nanoTime();
    AnalysisResult parallel = scheduler.runParallel(snapshot, workerCount);
    Duration parallelTime = Duration.ofNanos(System.nanoTime() - start);
    metrics.recordDuration("parallel", parallelTime);
    log.info("Parallel run took {} ms", parallelTime.toMillis());

    verifyEquivalent(sequential, parallel);
    metrics.reportResult(sequential);

    BenchmarkReport report = new BenchmarkReport(
      sequentialTime, parallelTime, workerCount, sequential.stats().size(), sequential.anomalies().size());
    log.info("Speedup: {}x", String.format("%.2f", report.speedup()));
    return report;
  }

  private static void verifyEquivalent(AnalysisResult sequential, AnalysisResult parallel) {
    if (!sequential.stats().equals(parallel.stats())
        || !new HashSet<>(sequential.anomalies()).equals(new HashSet<>(parallel.anomalies()))) {
      throw new AnalysisException("Sequential and parallel runs produced different results");
    }
  }
}
