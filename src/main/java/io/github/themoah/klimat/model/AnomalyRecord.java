package io.github.themoah.klimat.model;

/**
 * An observation flagged as anomalous against its partition baseline.
 *
 * @param observation the flagged observation
 * @param stat the seasonal statistics it was evaluated against
 * @param deviation temperature minus the partition mean
 * @param zScore how many standard deviations the temperature is from the mean
 */
public record AnomalyRecord(
  Observation observation,
  SeasonalStat stat,
  double deviation,
  double zScore
) {

  public String city() {
    return observation.city();
  }

  public Season season() {
    return observation.season();
  }
}
