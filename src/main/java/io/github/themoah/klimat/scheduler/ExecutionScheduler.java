package io.github.themoah.klimat.scheduler;

import io.github.themoah.klimat.config.AnalysisConfig;
import io.github.themoah.klimat.detect.AnomalyDetector;
import io.github.themoah.klimat.error.AnalysisException;
import io.github.themoah.klimat.error.WorkerFailureException;
import io.github.themoah.klimat.model.AnalysisResult;
import io.github.themoah.klimat.model.AnomalyRecord;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.ObservationSnapshot;
import io.github.themoah.klimat.model.Partition;
import io.github.themoah.klimat.model.PartitionKey;
import io.github.themoah.klimat.model.Season;
import io.github.themoah.klimat.model.SeasonalStat;
import io.github.themoah.klimat.model.UndefinedDeviationWarning;
import io.github.themoah.klimat.stats.StatisticsAggregator;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.WorkerExecutor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the full analysis over a snapshot, dispatching anomaly detection per (city, season)
 * partition either sequentially or across a fixed pool of Vert.x worker threads.
 *
 * <p>Rolling averages and seasonal statistics are computed once per run, before dispatch.
 * Workers only read immutable partition copies and statistics records.
 */
public class ExecutionScheduler {

  private static final Logger log = LoggerFactory.getLogger(ExecutionScheduler.class);

  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

  private final Vertx vertx;
  private final StatisticsAggregator aggregator;
  private final AnomalyDetector detector;
  private final long workerTimeoutMs;
  private final int defaultWorkerCount;

  public ExecutionScheduler(Vertx vertx, AnalysisConfig config) {
    this(vertx, new StatisticsAggregator(config.rollingWindow()), new AnomalyDetector(),
      config.workerTimeoutMs(), config.workerCount());
  }

  /**
   * Constructor for testing with injectable components.
   */
  ExecutionScheduler(
    Vertx vertx,
    StatisticsAggregator aggregator,
    AnomalyDetector detector,
    long workerTimeoutMs,
    int defaultWorkerCount
  ) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
    this.detector = Objects.requireNonNull(detector, "detector cannot be null");
    this.workerTimeoutMs = workerTimeoutMs;
    this.defaultWorkerCount = defaultWorkerCount;
  }

  /**
   * Runs detection partition by partition on the calling thread.
   *
   * <p>Partitions are visited with cities in first-occurrence order and seasons in
   * {@link Season} order; anomalies are appended in that same order.
   *
   * @param snapshot the observations to analyze
   * @return the annotated observations, seasonal statistics and anomalies
   */
  public AnalysisResult runSequential(ObservationSnapshot snapshot) {
    Precomputed pre = precompute(snapshot);

    List<AnomalyRecord> anomalies = new ArrayList<>();
    for (Partition partition : pre.partitions()) {
      anomalies.addAll(detector.detect(partition, pre.statFor(partition.key())));
    }

    log.info("Sequential analysis complete: observations={}, partitions={}, anomalies={}",
      pre.observations().size(), pre.partitions().size(), anomalies.size());
    return pre.toResult(anomalies);
  }

  /**
   * Runs detection on the default number of workers.
   *
   * @see #runParallel(ObservationSnapshot, int)
   */
  public AnalysisResult runParallel(ObservationSnapshot snapshot) {
    return runParallel(snapshot, defaultWorkerCount);
  }

  /**
   * Runs detection across a fixed pool of {@code workerCount} workers and blocks until every
   * partition has been evaluated.
   *
   * <p>The anomaly set equals the sequential one; order within a partition is preserved but
   * order across partitions is not guaranteed. Must not be called from an event-loop thread.
   *
   * @param snapshot the observations to analyze
   * @param workerCount number of worker threads
   * @return the complete result
   * @throws WorkerFailureException if any worker fails or the batch times out
   */
  public AnalysisResult runParallel(ObservationSnapshot snapshot, int workerCount) {
    if (Context.isOnEventLoopThread()) {
      throw new IllegalStateException("runParallel blocks the calling thread, use runParallelAsync on an event loop");
    }

    try {
      return runParallelAsync(snapshot, workerCount).toCompletionStage().toCompletableFuture().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WorkerFailureException("Interrupted while waiting for detection workers", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AnalysisException analysisException) {
        throw analysisException;
      }
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new WorkerFailureException("Detection batch failed", cause);
    }
  }

  /**
   * Non-blocking form of {@link #runParallel(ObservationSnapshot, int)}.
   *
   * @return Future completed with the full result once every worker has finished,
   *     or failed with a single {@link WorkerFailureException}
   */
  public Future<AnalysisResult> runParallelAsync(ObservationSnapshot snapshot, int workerCount) {
    if (workerCount < 1) {
      return Future.failedFuture(new IllegalArgumentException("workerCount must be >= 1, got " + workerCount));
    }

    Precomputed pre;
    try {
      pre = precompute(snapshot);
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }

    List<List<Partition>> chunks = ChunkProcessor.balanceIntoChunks(pre.partitions(), workerCount, Partition::size);
    if (chunks.isEmpty()) {
      return Future.succeededFuture(pre.toResult(List.of()));
    }

    String poolName = "klimat-detector-" + POOL_SEQUENCE.incrementAndGet();
    WorkerExecutor executor = vertx.createSharedWorkerExecutor(
      poolName, workerCount, maxExecuteTimeNanos(workerTimeoutMs), TimeUnit.NANOSECONDS);
    log.debug("Dispatching {} partitions in {} chunks to pool {} ({} workers)",
      pre.partitions().size(), chunks.size(), poolName, workerCount);

    AtomicBoolean aborted = new AtomicBoolean(false);
    AtomicReference<Throwable> firstFailure = new AtomicReference<>();
    List<Future<List<AnomalyRecord>>> futures = new ArrayList<>(chunks.size());

    for (List<Partition> chunk : chunks) {
      Map<PartitionKey, SeasonalStat> chunkStats = pre.statsFor(chunk);
      Future<List<AnomalyRecord>> future = executor.executeBlocking(
        () -> detectChunk(chunk, chunkStats, aborted), false);
      future.onFailure(err -> {
        if (!(err instanceof CancellationException)) {
          firstFailure.compareAndSet(null, err);
        }
        aborted.set(true);
      });
      futures.add(future);
    }

    Promise<AnalysisResult> promise = Promise.promise();
    long timerId = workerTimeoutMs > 0
      ? vertx.setTimer(workerTimeoutMs, id -> {
          aborted.set(true);
          if (promise.tryFail(new WorkerFailureException(
              "Detection batch did not complete within " + workerTimeoutMs + "ms"))) {
            log.error("Detection batch on pool {} timed out after {}ms", poolName, workerTimeoutMs);
          }
        })
      : -1L;

    Future.join(futures).onComplete(ar -> {
      if (timerId >= 0) {
        vertx.cancelTimer(timerId);
      }
      if (ar.succeeded()) {
        List<List<AnomalyRecord>> chunkResults = new ArrayList<>(futures.size());
        for (Future<List<AnomalyRecord>> future : futures) {
          chunkResults.add(future.result());
        }
        List<AnomalyRecord> anomalies = ChunkProcessor.concatenate(chunkResults);
        if (promise.tryComplete(pre.toResult(anomalies))) {
          log.info("Parallel analysis complete: observations={}, partitions={}, workers={}, anomalies={}",
            pre.observations().size(), pre.partitions().size(), workerCount, anomalies.size());
        }
      } else {
        WorkerFailureException failure = aggregateFailure(futures, firstFailure.get());
        if (promise.tryFail(failure)) {
          log.error("Parallel analysis failed on pool {}", poolName, failure);
        }
      }
    });

    return promise.future()
      .onComplete(ar -> executor.close());
  }

  /**
   * Enumerates partitions of annotated observations: cities in first-occurrence order,
   * seasons in declaration order, absent pairs skipped.
   */
  /**
   * Blocked-thread warning limit for the detector pool; unbounded when the batch timeout is disabled.
   */
  static long maxExecuteTimeNanos(long workerTimeoutMs) {
    return workerTimeoutMs > 0 ? TimeUnit.MILLISECONDS.toNanos(workerTimeoutMs) : Long.MAX_VALUE;
  }

  static List<Partition> enumeratePartitions(List<String> cities, List<Observation> observations) {
    Map<PartitionKey, List<Observation>> grouped = new HashMap<>();
    for (Observation observation : observations) {
      grouped.computeIfAbsent(observation.partitionKey(), k -> new ArrayList<>()).add(observation);
    }

    List<Partition> partitions = new ArrayList<>(grouped.size());
    for (String city : cities) {
      for (Season season : Season.values()) {
        PartitionKey key = new PartitionKey(city, season);
        List<Observation> members = grouped.get(key);
        if (members != null) {
          partitions.add(new Partition(key, members));
        }
      }
    }
    return partitions;
  }

  private List<AnomalyRecord> detectChunk(
    List<Partition> chunk,
    Map<PartitionKey, SeasonalStat> stats,
    AtomicBoolean aborted
  ) {
    List<AnomalyRecord> found = new ArrayList<>();
    for (Partition partition : chunk) {
      if (aborted.get()) {
        throw new CancellationException("Batch aborted before partition " + partition.key());
      }
      found.addAll(detector.detect(partition, stats.get(partition.key())));
    }
    return found;
  }

  private static WorkerFailureException aggregateFailure(
    List<Future<List<AnomalyRecord>>> futures,
    Throwable first
  ) {
    WorkerFailureException failure = first != null
      ? new WorkerFailureException("Detection worker failed: " + first.getMessage(), first)
      : new WorkerFailureException("Detection batch was cancelled");

    for (Future<List<AnomalyRecord>> future : futures) {
      Throwable cause = future.cause();
      if (future.failed() && cause != first && !(cause instanceof CancellationException)) {
        failure.addSuppressed(cause);
      }
    }
    return failure;
  }

  private Precomputed precompute(ObservationSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot cannot be null");

    List<Observation> annotated = aggregator.computeRollingAverage(snapshot.observations());
    List<SeasonalStat> stats = aggregator.computeSeasonalStats(annotated);
    List<Partition> partitions = enumeratePartitions(snapshot.cities(), annotated);

    Map<PartitionKey, SeasonalStat> statsByKey = new LinkedHashMap<>();
    List<UndefinedDeviationWarning> warnings = new ArrayList<>();
    for (SeasonalStat stat : stats) {
      statsByKey.put(stat.key(), stat);
      if (!stat.hasDefinedDeviation()) {
        UndefinedDeviationWarning warning = new UndefinedDeviationWarning(stat.key(), stat.count());
        warnings.add(warning);
        log.warn(warning.message());
      }
    }

    return new Precomputed(annotated, stats, partitions, Map.copyOf(statsByKey), warnings);
  }

  /**
   * Outputs shared read-only by every worker of a run.
   */
  private record Precomputed(
    List<Observation> observations,
    List<SeasonalStat> stats,
    List<Partition> partitions,
    Map<PartitionKey, SeasonalStat> statsByKey,
    List<UndefinedDeviationWarning> warnings
  ) {

    SeasonalStat statFor(PartitionKey key) {
      SeasonalStat stat = statsByKey.get(key);
      if (stat == null) {
        throw new IllegalStateException("No seasonal statistics computed for " + key);
      }
      return stat;
    }

    Map<PartitionKey, SeasonalStat> statsFor(List<Partition> chunk) {
      Map<PartitionKey, SeasonalStat> subset = new HashMap<>();
      for (Partition partition : chunk) {
        subset.put(partition.key(), statFor(partition.key()));
      }
      return Map.copyOf(subset);
    }

    AnalysisResult toResult(List<AnomalyRecord> anomalies) {
      return new AnalysisResult(observations, stats, anomalies, warnings);
    }
  }
}
