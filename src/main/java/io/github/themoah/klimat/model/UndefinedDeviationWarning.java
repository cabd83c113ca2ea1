package io.github.themoah.klimat.model;

/**
 * Reported for a partition whose standard deviation is undefined (fewer than two observations).
 * Such a partition yields no anomalies.
 *
 * @param key the partition
 * @param count number of observations in the partition
 */
public record UndefinedDeviationWarning(PartitionKey key, int count) {

  public String message() {
    return "Standard deviation undefined for " + key + " (" + count
      + " observation" + (count == 1 ? "" : "s") + "), no anomalies evaluated";
  }
}
