package io.github.themoah.klimat.model;

import java.util.List;

/**
 * Multi-year temperature profile of one city by day of year.
 *
 * @param city the city name
 * @param points one point per day of year that has observations, ascending
 */
public record DayOfYearProfile(String city, List<Point> points) {

  public DayOfYearProfile {
    points = List.copyOf(points);
  }

  /**
   * Mean and spread of all observations falling on one day of year.
   *
   * @param dayOfYear 1-based day of year
   * @param mean mean temperature on that day across years
   * @param stdDev sample standard deviation, NaN when only one year contributes
   * @param count number of contributing observations
   */
  public record Point(int dayOfYear, double mean, double stdDev, int count) {

    public double lower() {
      return mean - stdDev;
    }

    public double upper() {
      return mean + stdDev;
    }
  }
}
