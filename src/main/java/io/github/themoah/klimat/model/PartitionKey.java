package io.github.themoah.klimat.model;

import java.util.Objects;

/**
 * Identifies a (city, season) partition.
 */
public record PartitionKey(String city, Season season) {

  public PartitionKey {
    Objects.requireNonNull(city, "city cannot be null");
    Objects.requireNonNull(season, "season cannot be null");
  }

  @Override
  public String toString() {
    return city + ":" + season.label();
  }
}
