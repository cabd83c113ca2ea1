package io.github.themoah.klimat.model;

/**
 * Baseline temperature statistics for one (city, season) partition.
 *
 * @param city the city name
 * @param season the season
 * @param meanTemp arithmetic mean of the partition's temperatures
 * @param stdDev sample standard deviation (n-1), NaN for partitions with fewer than two observations
 * @param count number of observations the statistics were computed from
 */
public record SeasonalStat(
  String city,
  Season season,
  double meanTemp,
  double stdDev,
  int count
) {

  public PartitionKey key() {
    return new PartitionKey(city, season);
  }

  public boolean hasDefinedDeviation() {
    return !Double.isNaN(stdDev);
  }
}
