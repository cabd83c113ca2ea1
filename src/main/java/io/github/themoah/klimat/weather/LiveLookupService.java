package io.github.themoah.klimat.weather;

import io.github.themoah.klimat.model.AnalysisResult;
import io.github.themoah.klimat.model.Season;
import io.github.themoah.klimat.model.SeasonalStat;
import io.vertx.core.Future;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the current temperature of a city and compares it with the city's seasonal baseline.
 */
public class LiveLookupService {

  private static final Logger log = LoggerFactory.getLogger(LiveLookupService.class);

  private final WeatherClient weatherClient;
  private final Clock clock;

  public LiveLookupService(WeatherClient weatherClient) {
    this(weatherClient, Clock.systemUTC());
  }

  LiveLookupService(WeatherClient weatherClient, Clock clock) {
    this.weatherClient = Objects.requireNonNull(weatherClient, "weatherClient cannot be null");
    this.clock = Objects.requireNonNull(clock, "clock cannot be null");
  }

  /**
   * Returns the season of today's date.
   */
  public Season currentSeason() {
    return Season.ofMonth(LocalDate.now(clock).getMonth());
  }

  public Future<LiveComparison> lookup(String city, Season season, AnalysisResult result) {
    return lookup(city, season, null, result);
  }

  /**
   * Compares the current temperature of a city with its stored baseline.
   *
   * @param city the city to look up
   * @param season the baseline season, or null for the current season
   * @param apiKey per-request API key, or null for the configured one
   * @param result the analysis holding the baselines
   * @return Future with the comparison; failed with IllegalArgumentException when no baseline
   *     exists, or with ExternalLookupException when the weather service fails
   */
  public Future<LiveComparison> lookup(String city, Season season, String apiKey, AnalysisResult result) {
    Season effectiveSeason = season != null ? season : currentSeason();
    SeasonalStat stat = result.statFor(city, effectiveSeason).orElse(null);
    if (stat == null) {
      return Future.failedFuture(new IllegalArgumentException(
        "No seasonal baseline for " + city + " in " + effectiveSeason.label()));
    }

    return weatherClient.currentWeather(city, apiKey)
      .map(weather -> LiveComparison.compare(weather, stat))
      .onSuccess(comparison -> {
        if (comparison.anomalous()) {
          log.info("Current temperature in {} is anomalous: deviation={} ({} std, {})",
            city, String.format("%.2f", comparison.deviation()),
            String.format("%.2f", comparison.deviationStd()), comparison.direction());
        }
      });
  }
}
