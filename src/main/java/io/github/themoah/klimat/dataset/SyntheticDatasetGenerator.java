package io.github.themoah.klimat.dataset;

import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.ObservationSnapshot;
import io.github.themoah.klimat.model.Season;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates a reproducible daily temperature history for a fixed set of cities.
 *
 * <p>Each day's temperature is the city's mean for the season of that day plus
 * Gaussian noise with a standard deviation of 5 degrees. Cities are emitted one
 * after another, each in date order.
 */
public final class SyntheticDatasetGenerator {

  private static final Logger log = LoggerFactory.getLogger(SyntheticDatasetGenerator.class);

  public static final LocalDate START_DATE = LocalDate.of(2010, 1, 1);
  public static final double NOISE_STD_DEV = 5.0;
  private static final int DAYS_PER_YEAR = 365;

  /**
   * Mean temperature per season, indexed winter, spring, summer, autumn.
   */
  static final Map<String, double[]> SEASONAL_MEANS = createSeasonalMeans();

  private final long seed;

  public SyntheticDatasetGenerator(long seed) {
    this.seed = seed;
  }

  public static List<String> cities() {
    return List.copyOf(SEASONAL_MEANS.keySet());
  }

  /**
   * Returns the mean temperature the generator uses for a city and season.
   *
   * @throws IllegalArgumentException if the city is not generated
   */
  public static double seasonalMean(String city, Season season) {
    double[] means = SEASONAL_MEANS.get(city);
    if (means == null) {
      throw new IllegalArgumentException("Unknown city: " + city);
    }
    return means[season.ordinal()];
  }

  /**
   * Generates {@code years * 365} consecutive days per city.
   *
   * @param years number of 365-day years to generate
   * @return the generated snapshot
   */
  public ObservationSnapshot generate(int years) {
    if (years < 1) {
      throw new IllegalArgumentException("years must be >= 1, got " + years);
    }

    Random random = new Random(seed);
    int days = years * DAYS_PER_YEAR;
    List<Observation> observations = new ArrayList<>(days * SEASONAL_MEANS.size());

    for (Map.Entry<String, double[]> entry : SEASONAL_MEANS.entrySet()) {
      String city = entry.getKey();
      double[] means = entry.getValue();
      for (int day = 0; day < days; day++) {
        LocalDate date = START_DATE.plusDays(day);
        Season season = Season.ofMonth(date.getMonth());
        double temperature = means[season.ordinal()] + random.nextGaussian() * NOISE_STD_DEV;
        observations.add(Observation.of(city, date, season, temperature));
      }
    }

    log.info("Generated {} synthetic observations for {} cities over {} years (seed={})",
      observations.size(), SEASONAL_MEANS.size(), years, seed);
    return ObservationSnapshot.of(observations);
  }

  private static Map<String, double[]> createSeasonalMeans() {
    Map<String, double[]> means = new LinkedHashMap<>();
    means.put("New York", new double[] {0, 10, 25, 15});
    means.put("London", new double[] {5, 11, 18, 12});
    means.put("Paris", new double[] {4, 12, 20, 13});
    means.put("Tokyo", new double[] {6, 15, 27, 18});
    means.put("Moscow", new double[] {-10, 5, 18, 8});
    means.put("Sydney", new double[] {12, 18, 25, 20});
    means.put("Berlin", new double[] {0, 10, 20, 11});
    means.put("Beijing", new double[] {-2, 13, 27, 16});
    means.put("Rio de Janeiro", new double[] {25, 25, 30, 25});
    means.put("Dubai", new double[] {20, 25, 36, 30});
    means.put("Los Angeles", new double[] {15, 18, 25, 20});
    means.put("Singapore", new double[] {27, 28, 28, 27});
    means.put("Mumbai", new double[] {25, 30, 35, 30});
    means.put("Cairo", new double[] {15, 25, 35, 25});
    means.put("Mexico City", new double[] {12, 18, 20, 15});
    return Collections.unmodifiableMap(means);
  }
}
