package io.github.themoah.klimat.weather;

import io.vertx.core.Future;

/**
 * Source of current weather conditions.
 */
public interface WeatherClient {

  /**
   * Fetches current conditions for a city.
   *
   * @param city the city name
   * @param apiKey credentials to use for this request, or null for the configured default
   * @return Future containing the conditions, or failed with
   *     {@link io.github.themoah.klimat.error.ExternalLookupException}
   */
  Future<CurrentWeather> currentWeather(String city, String apiKey);

  default Future<CurrentWeather> currentWeather(String city) {
    return currentWeather(city, null);
  }

  /**
   * Releases underlying resources.
   */
  Future<Void> close();
}
