package io.github.themoah.klimat.model;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outputs of one analysis run.
 *
 * @param observations every input observation annotated with its rolling average, in input order
 * @param stats one entry per (city, season) pair present, in partition enumeration order
 * @param anomalies flagged observations, a subset of {@code observations}
 * @param warnings partitions whose standard deviation was undefined
 */
public record AnalysisResult(
  List<Observation> observations,
  List<SeasonalStat> stats,
  List<AnomalyRecord> anomalies,
  List<UndefinedDeviationWarning> warnings
) {

  public AnalysisResult {
    observations = List.copyOf(observations);
    stats = List.copyOf(stats);
    anomalies = List.copyOf(anomalies);
    warnings = List.copyOf(warnings);
  }

  public List<Observation> observationsFor(String city) {
    return observations.stream()
      .filter(o -> o.city().equals(city))
      .collect(Collectors.toList());
  }

  public List<SeasonalStat> statsFor(String city) {
    return stats.stream()
      .filter(s -> s.city().equals(city))
      .collect(Collectors.toList());
  }

  public List<AnomalyRecord> anomaliesFor(String city) {
    return anomalies.stream()
      .filter(a -> a.city().equals(city))
      .collect(Collectors.toList());
  }

  public Optional<SeasonalStat> statFor(String city, Season season) {
    return stats.stream()
      .filter(s -> s.city().equals(city) && s.season() == season)
      .findFirst();
  }

  /**
   * Returns the cities present in the result, in partition enumeration order.
   */
  public List<String> cities() {
    return stats.stream()
      .map(SeasonalStat::city)
      .distinct()
      .collect(Collectors.toList());
  }
}
