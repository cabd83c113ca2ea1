package io.github.themoah.klimat.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.klimat.error.EmptyPartitionException;
import io.github.themoah.klimat.model.AnomalyRecord;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.Partition;
import io.github.themoah.klimat.model.PartitionKey;
import io.github.themoah.klimat.model.Season;
import io.github.themoah.klimat.model.SeasonalStat;
import io.github.themoah.klimat.stats.StatisticsAggregator;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnomalyDetector.
 */
public class AnomalyDetectorTest {

  private static final PartitionKey MOSCOW_WINTER = new PartitionKey("Moscow", Season.WINTER);

  private final AnomalyDetector detector = new AnomalyDetector();
  private final StatisticsAggregator aggregator = new StatisticsAggregator();

  private static Partition partition(PartitionKey key, double... temperatures) {
    List<Observation> observations = new ArrayList<>();
    for (int i = 0; i < temperatures.length; i++) {
      observations.add(Observation.of(key.city(), LocalDate.of(2020, 1, 1).plusDays(i), key.season(), temperatures[i]));
    }
    return new Partition(key, observations);
  }

  private SeasonalStat statOf(Partition partition) {
    return aggregator.computeSeasonalStats(partition.observations()).get(0);
  }

  @Test
  void moscow_fiveReadings_outlierWithinTwoSigma() {
    Partition partition = partition(MOSCOW_WINTER, -10, -12, -9, -11, -50);
    SeasonalStat stat = statOf(partition);

    assertEquals(-18.4, stat.meanTemp(), 1e-9);
    assertEquals(Math.sqrt(1253.2 / 4), stat.stdDev(), 1e-9);
    assertEquals(17.70, stat.stdDev(), 0.005);

    // |-50 - (-18.4)| = 31.6 < 2 * 17.70
    assertTrue(detector.detect(partition, stat).isEmpty());
  }

  @Test
  void moscow_sixReadings_flagsOnlyColdOutlier() {
    Partition partition = partition(MOSCOW_WINTER, -10, -12, -9, -11, -10, -50);
    SeasonalStat stat = statOf(partition);

    assertEquals(-17.0, stat.meanTemp(), 1e-9);
    assertEquals(Math.sqrt(262.4), stat.stdDev(), 1e-9);

    List<AnomalyRecord> anomalies = detector.detect(partition, stat);

    assertEquals(1, anomalies.size());
    AnomalyRecord anomaly = anomalies.get(0);
    assertEquals(-50.0, anomaly.observation().temperature());
    assertEquals(-33.0, anomaly.deviation(), 1e-9);
    assertEquals(-33.0 / Math.sqrt(262.4), anomaly.zScore(), 1e-9);
    assertEquals(stat, anomaly.stat());
  }

  @Test
  void detect_predicateIsExact() {
    Partition partition = partition(MOSCOW_WINTER, -10, -12, -9, -11, -10, -50, 3, 4, -30);
    SeasonalStat stat = statOf(partition);

    List<AnomalyRecord> anomalies = detector.detect(partition, stat);

    for (Observation observation : partition.observations()) {
      boolean expected = Math.abs(observation.temperature() - stat.meanTemp()) > 2 * stat.stdDev();
      boolean flagged = anomalies.stream().anyMatch(a -> a.observation() == observation);
      assertEquals(expected, flagged, "temperature " + observation.temperature());
    }
  }

  @Test
  void detect_keepsPartitionOrder() {
    Partition partition = partition(MOSCOW_WINTER, 40, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, -40);
    List<AnomalyRecord> anomalies = detector.detect(partition, statOf(partition));

    assertEquals(2, anomalies.size());
    assertEquals(40.0, anomalies.get(0).observation().temperature());
    assertEquals(-40.0, anomalies.get(1).observation().temperature());
  }

  @Test
  void detect_singleton_noAnomalies() {
    Partition partition = partition(MOSCOW_WINTER, -50);

    assertTrue(detector.detect(partition, statOf(partition)).isEmpty());
  }

  @Test
  void detect_identicalValues_noAnomalies() {
    Partition partition = partition(MOSCOW_WINTER, -5, -5, -5, -5);

    assertTrue(detector.detect(partition, statOf(partition)).isEmpty());
  }

  @Test
  void detect_emptyPartition_throws() {
    Partition empty = new Partition(MOSCOW_WINTER, List.of());
    SeasonalStat stat = new SeasonalStat("Moscow", Season.WINTER, 0, 1, 0);

    EmptyPartitionException e = assertThrows(EmptyPartitionException.class, () -> detector.detect(empty, stat));
    assertTrue(e.getMessage().contains("Moscow:winter"));
  }

  @Test
  void detect_statisticsOfOtherPartition_throws() {
    Partition partition = partition(MOSCOW_WINTER, -10, -12);
    SeasonalStat summer = new SeasonalStat("Moscow", Season.SUMMER, 18, 3, 90);

    assertThrows(IllegalArgumentException.class, () -> detector.detect(partition, summer));
  }
}
