package io.github.themoah.klimat.stats;

import io.github.themoah.klimat.model.DayOfYearProfile;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.PartitionKey;
import io.github.themoah.klimat.model.Season;
import io.github.themoah.klimat.model.SeasonalStat;
import io.github.themoah.klimat.stats.StatisticalUtils.Stats;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes rolling averages and per-partition seasonal statistics from an observation sequence.
 *
 * <p>Stateless apart from the configured window, so a single instance may be shared across threads.
 */
public class StatisticsAggregator {

  private static final Logger log = LoggerFactory.getLogger(StatisticsAggregator.class);

  public static final int DEFAULT_ROLLING_WINDOW = 30;

  private final int rollingWindow;

  public StatisticsAggregator() {
    this(DEFAULT_ROLLING_WINDOW);
  }

  public StatisticsAggregator(int rollingWindow) {
    if (rollingWindow < 1) {
      throw new IllegalArgumentException("rollingWindow must be >= 1, got " + rollingWindow);
    }
    this.rollingWindow = rollingWindow;
  }

  public int rollingWindow() {
    return rollingWindow;
  }

  public List<Observation> computeRollingAverage(List<Observation> observations) {
    return computeRollingAverage(observations, rollingWindow);
  }

  /**
   * Annotates every observation with the trailing mean of itself and up to
   * {@code window - 1} preceding observations of the same city.
   *
   * <p>The window counts rows in input order, not calendar days. The first
   * observations of a city use a partial window.
   *
   * @param observations observations, time-ordered within each city
   * @param window the number of rows in a full window
   * @return annotated observations in the same order and cardinality as the input
   */
  public List<Observation> computeRollingAverage(List<Observation> observations, int window) {
    if (window < 1) {
      throw new IllegalArgumentException("window must be >= 1, got " + window);
    }

    Map<String, CityWindow> windows = new HashMap<>();
    List<Observation> result = new ArrayList<>(observations.size());

    for (Observation observation : observations) {
      CityWindow cityWindow = windows.computeIfAbsent(observation.city(), k -> new CityWindow(window));
      double average = cityWindow.add(observation.temperature());
      result.add(observation.withRollingAverage(average));
    }

    log.debug("Computed rolling average (window={}) for {} observations across {} cities",
      window, result.size(), windows.size());
    return result;
  }

  /**
   * Computes mean and sample standard deviation for every (city, season) pair present.
   *
   * @param observations the observations to group
   * @return one stat per present partition, cities in first-occurrence order then seasons in declaration order
   */
  public List<SeasonalStat> computeSeasonalStats(List<Observation> observations) {
    Map<PartitionKey, List<Double>> temperatures = groupTemperatures(observations);

    List<SeasonalStat> stats = new ArrayList<>(temperatures.size());
    for (String city : distinctCities(temperatures)) {
      for (Season season : Season.values()) {
        List<Double> values = temperatures.get(new PartitionKey(city, season));
        if (values == null) {
          continue;
        }
        Stats s = StatisticalUtils.calculateSampleStats(toArray(values));
        stats.add(new SeasonalStat(city, season, s.mean(), s.stdDev(), s.count()));
      }
    }

    log.debug("Computed seasonal stats for {} partitions", stats.size());
    return stats;
  }

  /**
   * Builds the day-of-year temperature profile of one city across all years in the data.
   *
   * @param observations observations of any number of cities
   * @param city the city to profile
   * @return profile points ordered by day of year; empty if the city has no observations
   */
  public DayOfYearProfile computeDayOfYearProfile(List<Observation> observations, String city) {
    Map<Integer, List<Double>> byDay = new TreeMap<>();
    for (Observation observation : observations) {
      if (observation.city().equals(city)) {
        byDay.computeIfAbsent(observation.timestamp().getDayOfYear(), k -> new ArrayList<>())
          .add(observation.temperature());
      }
    }

    List<DayOfYearProfile.Point> points = new ArrayList<>(byDay.size());
    for (Map.Entry<Integer, List<Double>> entry : byDay.entrySet()) {
      Stats s = StatisticalUtils.calculateSampleStats(toArray(entry.getValue()));
      points.add(new DayOfYearProfile.Point(entry.getKey(), s.mean(), s.stdDev(), s.count()));
    }
    return new DayOfYearProfile(city, points);
  }

  private static Map<PartitionKey, List<Double>> groupTemperatures(List<Observation> observations) {
    Map<PartitionKey, List<Double>> grouped = new LinkedHashMap<>();
    for (Observation observation : observations) {
      grouped.computeIfAbsent(observation.partitionKey(), k -> new ArrayList<>())
        .add(observation.temperature());
    }
    return grouped;
  }

  private static List<String> distinctCities(Map<PartitionKey, List<Double>> grouped) {
    return grouped.keySet().stream()
      .map(PartitionKey::city)
      .distinct()
      .collect(Collectors.toList());
  }

  private static double[] toArray(List<Double> values) {
    double[] array = new double[values.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = values.get(i);
    }
    return array;
  }

  /**
   * Fixed-capacity trailing window of one city's temperatures.
   * The sum is recomputed from the retained values on every row.
   */
  private static final class CityWindow {
    private final ArrayDeque<Double> values;
    private final int capacity;

    CityWindow(int capacity) {
      this.values = new ArrayDeque<>(capacity);
      this.capacity = capacity;
    }

    double add(double value) {
      if (values.size() >= capacity) {
        values.removeFirst();  // Evict oldest
      }
      values.addLast(value);

      double sum = 0.0;
      for (double v : values) {
        sum += v;
      }
      return sum / values.size();
    }
  }
}
