package io.github.themoah.klimat.error;

import io.github.themoah.klimat.model.PartitionKey;

/**
 * Raised when a (city, season) partition with no observations reaches anomaly detection.
 */
public class EmptyPartitionException extends AnalysisException {

  private final PartitionKey key;

  public EmptyPartitionException(PartitionKey key) {
    super("Partition " + key + " has no observations");
    this.key = key;
  }

  public PartitionKey key() {
    return key;
  }
}
