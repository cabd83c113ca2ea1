package io.github.themoah.klimat.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.klimat.model.DayOfYearProfile;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.Season;
import io.github.themoah.klimat.model.SeasonalStat;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatisticsAggregator.
 */
public class StatisticsAggregatorTest {

  private static final LocalDate START = LocalDate.of(2020, 1, 1);

  private static Observation obs(String city, int day, Season season, double temperature) {
    return Observation.of(city, START.plusDays(day), season, temperature);
  }

  private static List<Observation> series(String city, double... temperatures) {
    List<Observation> observations = new ArrayList<>();
    for (int i = 0; i < temperatures.length; i++) {
      observations.add(obs(city, i, Season.WINTER, temperatures[i]));
    }
    return observations;
  }

  @Test
  void computeRollingAverage_partialWindowThenTrailing() {
    List<Observation> result = new StatisticsAggregator(3)
        .computeRollingAverage(series("Oslo", 1, 2, 3, 4, 5));

    assertEquals(1.0, result.get(0).rollingAverage(), 1e-12);
    assertEquals(1.5, result.get(1).rollingAverage(), 1e-12);
    assertEquals(2.0, result.get(2).rollingAverage(), 1e-12);
    assertEquals(3.0, result.get(3).rollingAverage(), 1e-12);
    assertEquals(4.0, result.get(4).rollingAverage(), 1e-12);
  }

  @Test
  void computeRollingAverage_defaultWindowIsThirtyRows() {
    double[] temperatures = new double[31];
    for (int i = 0; i < temperatures.length; i++) {
      temperatures[i] = i + 1;
    }

    List<Observation> result = new StatisticsAggregator().computeRollingAverage(series("Oslo", temperatures));

    assertEquals(15.5, result.get(29).rollingAverage(), 1e-12);
    assertEquals(16.5, result.get(30).rollingAverage(), 1e-12);
  }

  @Test
  void computeRollingAverage_citiesAreIndependent() {
    List<Observation> input = List.of(
        obs("Oslo", 0, Season.WINTER, 1),
        obs("Rome", 0, Season.WINTER, 10),
        obs("Oslo", 1, Season.WINTER, 3),
        obs("Rome", 1, Season.WINTER, 20)
    );

    List<Observation> result = new StatisticsAggregator(30).computeRollingAverage(input);

    assertEquals(1.0, result.get(0).rollingAverage(), 1e-12);
    assertEquals(10.0, result.get(1).rollingAverage(), 1e-12);
    assertEquals(2.0, result.get(2).rollingAverage(), 1e-12);
    assertEquals(15.0, result.get(3).rollingAverage(), 1e-12);
  }

  @Test
  void computeRollingAverage_preservesOrderAndCardinality() {
    List<Observation> input = series("Oslo", 4, 8, 15, 16, 23, 42);

    List<Observation> result = new StatisticsAggregator(2).computeRollingAverage(input);

    assertEquals(input.size(), result.size());
    for (int i = 0; i < input.size(); i++) {
      assertEquals(input.get(i).timestamp(), result.get(i).timestamp());
      assertEquals(input.get(i).temperature(), result.get(i).temperature());
      assertTrue(result.get(i).hasRollingAverage());
    }
  }

  @Test
  void computeRollingAverage_noLookahead() {
    StatisticsAggregator aggregator = new StatisticsAggregator(5);
    List<Observation> original = aggregator.computeRollingAverage(series("Oslo", 1, 2, 3, 4, 5, 6));
    List<Observation> changedTail = aggregator.computeRollingAverage(series("Oslo", 1, 2, 3, 4, 500, 600));

    for (int i = 0; i < 4; i++) {
      assertEquals(original.get(i).rollingAverage(), changedTail.get(i).rollingAverage());
    }
  }

  @Test
  void rollingWindow_mustBePositive() {
    assertThrows(IllegalArgumentException.class, () -> new StatisticsAggregator(0));
    assertThrows(IllegalArgumentException.class,
        () -> new StatisticsAggregator().computeRollingAverage(List.of(), 0));
  }

  @Test
  void computeSeasonalStats_meanAndSampleStdDev() {
    List<Observation> input = List.of(
        obs("Oslo", 0, Season.WINTER, -4),
        obs("Oslo", 1, Season.WINTER, -2),
        obs("Oslo", 2, Season.WINTER, 0)
    );

    List<SeasonalStat> stats = new StatisticsAggregator().computeSeasonalStats(input);

    assertEquals(1, stats.size());
    SeasonalStat stat = stats.get(0);
    assertEquals(-2.0, stat.meanTemp(), 1e-12);
    assertEquals(2.0, stat.stdDev(), 1e-12);
    assertEquals(3, stat.count());
  }

  @Test
  void computeSeasonalStats_orderedByCityThenSeason() {
    List<Observation> input = List.of(
        obs("Rome", 0, Season.SUMMER, 30),
        obs("Oslo", 0, Season.AUTUMN, 5),
        obs("Rome", 1, Season.WINTER, 10),
        obs("Oslo", 1, Season.WINTER, -5),
        obs("Rome", 2, Season.SUMMER, 31)
    );

    List<SeasonalStat> stats = new StatisticsAggregator().computeSeasonalStats(input);

    assertEquals(4, stats.size());
    assertEquals("Rome", stats.get(0).city());
    assertEquals(Season.WINTER, stats.get(0).season());
    assertEquals(Season.SUMMER, stats.get(1).season());
    assertEquals("Oslo", stats.get(2).city());
    assertEquals(Season.WINTER, stats.get(2).season());
    assertEquals(Season.AUTUMN, stats.get(3).season());
  }

  @Test
  void computeSeasonalStats_singletonHasUndefinedDeviation() {
    List<SeasonalStat> stats = new StatisticsAggregator()
        .computeSeasonalStats(List.of(obs("Oslo", 0, Season.SPRING, 7)));

    assertEquals(7.0, stats.get(0).meanTemp());
    assertTrue(Double.isNaN(stats.get(0).stdDev()));
    assertEquals(1, stats.get(0).count());
  }

  @Test
  void computeDayOfYearProfile_groupsAcrossYears() {
    List<Observation> input = List.of(
        Observation.of("Oslo", LocalDate.of(2019, 1, 2), Season.WINTER, -6),
        Observation.of("Oslo", LocalDate.of(2020, 1, 2), Season.WINTER, -2),
        Observation.of("Oslo", LocalDate.of(2020, 1, 1), Season.WINTER, -3),
        Observation.of("Rome", LocalDate.of(2020, 1, 1), Season.WINTER, 12)
    );

    DayOfYearProfile profile = new StatisticsAggregator().computeDayOfYearProfile(input, "Oslo");

    assertEquals(2, profile.points().size());
    DayOfYearProfile.Point first = profile.points().get(0);
    assertEquals(1, first.dayOfYear());
    assertEquals(-3.0, first.mean());
    assertTrue(Double.isNaN(first.stdDev()));

    DayOfYearProfile.Point second = profile.points().get(1);
    assertEquals(2, second.dayOfYear());
    assertEquals(-4.0, second.mean(), 1e-12);
    assertEquals(Math.sqrt(8), second.stdDev(), 1e-12);
    assertEquals(-4.0 - Math.sqrt(8), second.lower(), 1e-12);
    assertEquals(2, second.count());
  }
}
