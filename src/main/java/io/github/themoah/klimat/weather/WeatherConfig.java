package io.github.themoah.klimat.weather;

import io.github.themoah.klimat.config.Env;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the live weather lookup.
 *
 * @param apiKey OpenWeatherMap API key, null when not configured
 * @param baseUrl API base URL without trailing slash
 * @param timeoutMs request timeout in milliseconds
 */
public record WeatherConfig(String apiKey, String baseUrl, long timeoutMs) {

  private static final Logger log = LoggerFactory.getLogger(WeatherConfig.class);

  public static final String DEFAULT_BASE_URL = "https://api.openweathermap.org";
  private static final long DEFAULT_TIMEOUT_MS = 10_000L;

  public WeatherConfig {
    if (baseUrl != null && baseUrl.endsWith("/")) {
      baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
    }
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>OPENWEATHERMAP_API_KEY - API key (default: none; per-request keys are still accepted)</li>
   *   <li>OPENWEATHERMAP_BASE_URL - API base URL (default: https://api.openweathermap.org)</li>
   *   <li>OPENWEATHERMAP_TIMEOUT_MS - Request timeout (default: 10000)</li>
   * </ul>
   */
  public static WeatherConfig fromEnvironment() {
    return from(System.getenv());
  }

  static WeatherConfig from(Map<String, String> env) {
    String apiKey = Env.getString(env, "OPENWEATHERMAP_API_KEY", null);
    String baseUrl = Env.getString(env, "OPENWEATHERMAP_BASE_URL", DEFAULT_BASE_URL);
    long timeoutMs = Env.getLong(env, "OPENWEATHERMAP_TIMEOUT_MS", DEFAULT_TIMEOUT_MS);

    WeatherConfig config = new WeatherConfig(apiKey, baseUrl, timeoutMs);
    log.info("Weather config: baseUrl={}, apiKeyConfigured={}, timeoutMs={}",
      config.baseUrl(), config.hasApiKey(), timeoutMs);
    return config;
  }

  @Override
  public String toString() {
    return "WeatherConfig[apiKey=" + (hasApiKey() ? "***" : "<none>")
      + ", baseUrl=" + baseUrl + ", timeoutMs=" + timeoutMs + "]";
  }
}
