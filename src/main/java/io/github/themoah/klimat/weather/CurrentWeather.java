package io.github.themoah.klimat.weather;

/**
 * Current conditions reported by the weather service for one city.
 *
 * @param city city name as resolved by the service
 * @param temperature current temperature in degrees Celsius
 * @param windSpeed wind speed in metres per second, NaN if not reported
 * @param description short human-readable description, empty if not reported
 */
public record CurrentWeather(String city, double temperature, double windSpeed, String description) {}
