package io.github.themoah.klimat.stats;

/**
 * Utility methods for the statistics behind seasonal baselines and anomaly flags.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates mean and sample standard deviation of the given values.
   *
   * <p>Uses the sample standard deviation (divide by n-1) since each partition
   * is a sample of the city's climate for that season. A single value yields
   * a NaN standard deviation; an empty input yields NaN for both.
   *
   * @param values the values to analyze
   * @return statistics containing mean, standard deviation and count
   */
  public static Stats calculateSampleStats(double[] values) {
    int n = values.length;
    if (n == 0) {
      return new Stats(Double.NaN, Double.NaN, 0);
    }

    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    double mean = sum / n;

    if (n < 2) {
      return new Stats(mean, Double.NaN, n);
    }

    double sumSquaredDiffs = 0.0;
    for (double value : values) {
      double diff = value - mean;
      sumSquaredDiffs += diff * diff;
    }
    double variance = sumSquaredDiffs / (n - 1);

    return new Stats(mean, Math.sqrt(variance), n);
  }

  /**
   * Determines if a value lies strictly further than {@code sigmaMultiplier}
   * standard deviations from the mean, in either direction.
   *
   * @param value the value to check
   * @param mean the mean of the distribution
   * @param stdDev the standard deviation
   * @param sigmaMultiplier the number of standard deviations for the outlier threshold
   * @return true if |value - mean| > sigmaMultiplier * stdDev; false when stdDev is NaN
   */
  public static boolean isOutlier(double value, double mean, double stdDev, double sigmaMultiplier) {
    if (Double.isNaN(stdDev)) {
      return false;
    }
    return Math.abs(value - mean) > sigmaMultiplier * stdDev;
  }

  /**
   * Calculates the z-score for a value.
   *
   * @param value the value
   * @param mean the mean
   * @param stdDev the standard deviation
   * @return (value - mean) / stdDev, NaN if stdDev is NaN, or 0 if stdDev is near zero
   */
  public static double zScore(double value, double mean, double stdDev) {
    if (Double.isNaN(stdDev)) {
      return Double.NaN;
    }
    if (stdDev < 1e-10) {
      return 0.0;
    }
    return (value - mean) / stdDev;
  }

  /**
   * Statistics result record.
   *
   * @param mean the arithmetic mean
   * @param stdDev the sample standard deviation
   * @param count number of values
   */
  public record Stats(double mean, double stdDev, int count) {}
}
