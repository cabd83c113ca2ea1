package io.github.themoah.klimat.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A single daily temperature measurement for a city.
 *
 * @param city the city name
 * @param timestamp the measurement date
 * @param season the season label the measurement was recorded under
 * @param temperature the temperature in degrees Celsius
 * @param rollingAverage trailing mean over recent same-city observations, NaN until computed
 */
public record Observation(
  String city,
  LocalDate timestamp,
  Season season,
  double temperature,
  double rollingAverage
) {

  public Observation {
    Objects.requireNonNull(city, "city cannot be null");
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
    Objects.requireNonNull(season, "season cannot be null");
  }

  /**
   * Creates an observation whose rolling average has not been computed yet.
   */
  public static Observation of(String city, LocalDate timestamp, Season season, double temperature) {
    return new Observation(city, timestamp, season, temperature, Double.NaN);
  }

  public Observation withRollingAverage(double rollingAverage) {
    return new Observation(city, timestamp, season, temperature, rollingAverage);
  }

  public PartitionKey partitionKey() {
    return new PartitionKey(city, season);
  }

  public boolean hasRollingAverage() {
    return !Double.isNaN(rollingAverage);
  }
}
