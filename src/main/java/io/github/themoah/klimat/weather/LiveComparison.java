package io.github.themoah.klimat.weather;

import io.github.themoah.klimat.detect.AnomalyDetector;
import io.github.themoah.klimat.model.SeasonalStat;

/**
 * Current temperature compared against the stored seasonal baseline of its city.
 *
 * @param weather the current conditions
 * @param stat the seasonal baseline used
 * @param deviation current temperature minus the seasonal mean
 * @param deviationStd deviation in standard deviations, NaN when the baseline has no deviation
 * @param anomalous true when |deviationStd| exceeds the anomaly threshold
 */
public record LiveComparison(
  CurrentWeather weather,
  SeasonalStat stat,
  double deviation,
  double deviationStd,
  boolean anomalous
) {

  /**
   * Direction of an anomalous reading relative to the baseline.
   */
  public enum Direction {
    ABOVE,
    BELOW,
    NORMAL
  }

  /**
   * Compares a bare temperature reading with a baseline.
   */
  public static LiveComparison compare(double currentTemp, SeasonalStat stat) {
    return compare(new CurrentWeather(stat.city(), currentTemp, Double.NaN, ""), stat);
  }

  public static LiveComparison compare(CurrentWeather weather, SeasonalStat stat) {
    double deviation = weather.temperature() - stat.meanTemp();
    double deviationStd = deviation / stat.stdDev();
    boolean anomalous = stat.hasDefinedDeviation()
      && Math.abs(deviationStd) > AnomalyDetector.SIGMA_MULTIPLIER;
    return new LiveComparison(weather, stat, deviation, deviationStd, anomalous);
  }

  public Direction direction() {
    if (!anomalous) {
      return Direction.NORMAL;
    }
    return deviation > 0 ? Direction.ABOVE : Direction.BELOW;
  }
}
