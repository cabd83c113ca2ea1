package io.github.themoah.klimat.metrics;

import io.github.themoah.klimat.model.AnalysisResult;
import io.github.themoah.klimat.model.AnomalyRecord;
import io.github.themoah.klimat.model.PartitionKey;
import io.github.themoah.klimat.model.SeasonalStat;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes analysis outcomes and run durations to a Micrometer registry.
 */
public class AnalysisMetrics {

  private static final Logger log = LoggerFactory.getLogger(AnalysisMetrics.class);

  static final String PARTITIONS = "klimat.partitions";
  static final String OBSERVATIONS = "klimat.observations";
  static final String ANOMALIES = "klimat.anomalies";
  static final String UNDEFINED_DEVIATION = "klimat.undefined_deviation.partitions";
  static final String DURATION = "klimat.analysis.duration";

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

  public AnalysisMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  public MeterRegistry registry() {
    return registry;
  }

  /**
   * Records gauges describing one analysis result: totals plus anomaly counts per city and season.
   */
  public void reportResult(AnalysisResult result) {
    recordGauge(OBSERVATIONS, Tags.empty(), result.observations().size());
    recordGauge(PARTITIONS, Tags.empty(), result.stats().size());
    recordGauge(UNDEFINED_DEVIATION, Tags.empty(), result.warnings().size());

    Map<PartitionKey, Long> counts = new HashMap<>();
    for (SeasonalStat stat : result.stats()) {
      counts.put(stat.key(), 0L);
    }
    for (AnomalyRecord anomaly : result.anomalies()) {
      counts.merge(anomaly.stat().key(), 1L, Long::sum);
    }
    counts.forEach((key, count) -> recordGauge(ANOMALIES,
      Tags.of("city", key.city(), "season", key.season().label()), count));

    log.debug("Reported metrics for {} partitions, {} anomalies", counts.size(), result.anomalies().size());
  }

  /**
   * Records the wall-clock duration of one analysis run.
   *
   * @param mode "sequential" or "parallel"
   * @param duration the measured duration
   */
  public void recordDuration(String mode, Duration duration) {
    Timer.builder(DURATION)
      .description("Wall-clock duration of an end-to-end analysis run")
      .tag("mode", mode)
      .register(registry)
      .record(duration);
  }

  private void recordGauge(String name, Tags tags, long value) {
    String key = name + tags;
    gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong holder = new AtomicLong();
      Gauge.builder(name, holder, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return holder;
    }).set(value);
  }
}
