package io.github.themoah.klimat.detect;

import io.github.themoah.klimat.error.EmptyPartitionException;
import io.github.themoah.klimat.model.AnomalyRecord;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.Partition;
import io.github.themoah.klimat.model.SeasonalStat;
import io.github.themoah.klimat.stats.StatisticalUtils;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags observations that deviate from their partition mean by more than two standard deviations.
 *
 * <p>Detection is partition-local: an invocation reads only the observations and the
 * statistics it is given, and holds no state of its own. Invocations for different
 * partitions may therefore run concurrently.
 */
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  /**
   * Fixed anomaly threshold in standard deviations.
   */
  public static final double SIGMA_MULTIPLIER = 2.0;

  /**
   * Detects anomalies in one partition.
   *
   * @param partition the partition's observations
   * @param stat the statistics computed from exactly this partition
   * @return anomalous observations in partition order
   * @throws EmptyPartitionException if the partition has no observations
   * @throws IllegalArgumentException if the statistics belong to another partition
   */
  public List<AnomalyRecord> detect(Partition partition, SeasonalStat stat) {
    if (partition.isEmpty()) {
      throw new EmptyPartitionException(partition.key());
    }
    if (!partition.key().equals(stat.key())) {
      throw new IllegalArgumentException(
        "Statistics for " + stat.key() + " cannot evaluate partition " + partition.key());
    }
    return detectPartition(partition.observations(), stat);
  }

  /**
   * Returns the observations where {@code |temperature - mean| > 2 * stdDev}.
   *
   * <p>When the standard deviation is undefined no observation is anomalous.
   *
   * @param partitionObservations observations sharing the stat's (city, season)
   * @param stat the partition's statistics
   * @return anomalous observations in input order, never null
   */
  public List<AnomalyRecord> detectPartition(List<Observation> partitionObservations, SeasonalStat stat) {
    if (!stat.hasDefinedDeviation()) {
      log.debug("Skipping partition {}: standard deviation undefined", stat.key());
      return List.of();
    }

    List<AnomalyRecord> anomalies = new ArrayList<>();
    for (Observation observation : partitionObservations) {
      double temperature = observation.temperature();
      if (StatisticalUtils.isOutlier(temperature, stat.meanTemp(), stat.stdDev(), SIGMA_MULTIPLIER)) {
        double deviation = temperature - stat.meanTemp();
        double zScore = StatisticalUtils.zScore(temperature, stat.meanTemp(), stat.stdDev());
        anomalies.add(new AnomalyRecord(observation, stat, deviation, zScore));

        if (log.isTraceEnabled()) {
          log.trace("Anomaly detected: city={}, season={}, date={}, temperature={}, mean={}, stdDev={}, zScore={}",
            observation.city(), observation.season().label(), observation.timestamp(), temperature,
            String.format("%.2f", stat.meanTemp()), String.format("%.2f", stat.stdDev()),
            String.format("%.2f", zScore));
        }
      }
    }
    return anomalies;
  }
}
