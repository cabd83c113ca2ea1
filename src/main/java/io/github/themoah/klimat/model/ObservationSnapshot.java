package io.github.themoah.klimat.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered dataset passed explicitly into every analysis entry point.
 *
 * <p>Cities are remembered in the order of their first occurrence, which fixes
 * the partition enumeration order of a run.
 */
public final class ObservationSnapshot {

  private final List<Observation> observations;
  private final List<String> cities;

  private ObservationSnapshot(List<Observation> observations) {
    this.observations = List.copyOf(observations);
    Set<String> seen = new LinkedHashSet<>();
    for (Observation observation : this.observations) {
      seen.add(observation.city());
    }
    this.cities = List.copyOf(seen);
  }

  public static ObservationSnapshot of(List<Observation> observations) {
    return new ObservationSnapshot(observations);
  }

  public static ObservationSnapshot empty() {
    return new ObservationSnapshot(List.of());
  }

  public List<Observation> observations() {
    return observations;
  }

  /**
   * Returns the distinct cities in first-occurrence order.
   */
  public List<String> cities() {
    return cities;
  }

  public int size() {
    return observations.size();
  }

  public boolean isEmpty() {
    return observations.isEmpty();
  }

  /**
   * Returns a new snapshot restricted to one city, preserving order.
   */
  public ObservationSnapshot forCity(String city) {
    List<Observation> filtered = new ArrayList<>();
    for (Observation observation : observations) {
      if (observation.city().equals(city)) {
        filtered.add(observation);
      }
    }
    return new ObservationSnapshot(filtered);
  }

  @Override
  public String toString() {
    return "ObservationSnapshot{observations=" + observations.size() + ", cities=" + cities.size() + "}";
  }
}
