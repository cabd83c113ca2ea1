package io.github.themoah.klimat.model;

import java.util.List;
import java.util.Objects;

/**
 * Observations sharing one (city, season) key, in input order.
 * Holds its own immutable copy so it can be handed to a worker thread as a value.
 */
public record Partition(PartitionKey key, List<Observation> observations) {

  public Partition {
    Objects.requireNonNull(key, "key cannot be null");
    observations = List.copyOf(observations);
  }

  public int size() {
    return observations.size();
  }

  public boolean isEmpty() {
    return observations.isEmpty();
  }
}
