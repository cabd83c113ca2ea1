package io.github.themoah.klimat.weather;

import io.github.themoah.klimat.error.ExternalLookupException;
import io.github.themoah.klimat.error.ExternalLookupException.Reason;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WeatherClient} backed by the OpenWeatherMap current weather API.
 */
public class OpenWeatherMapClient implements WeatherClient {

  private static final Logger log = LoggerFactory.getLogger(OpenWeatherMapClient.class);

  static final String WEATHER_PATH = "/data/2.5/weather";

  private final WebClient webClient;
  private final WeatherConfig config;

  public OpenWeatherMapClient(Vertx vertx, WeatherConfig config) {
    this(WebClient.create(vertx), config);
  }

  /**
   * Constructor for testing with an existing web client.
   */
  OpenWeatherMapClient(WebClient webClient, WeatherConfig config) {
    this.webClient = Objects.requireNonNull(webClient, "webClient cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  @Override
  public Future<CurrentWeather> currentWeather(String city, String apiKey) {
    Objects.requireNonNull(city, "city cannot be null");
    String key = apiKey != null && !apiKey.isBlank() ? apiKey : config.apiKey();
    if (key == null || key.isBlank()) {
      return Future.failedFuture(new ExternalLookupException(Reason.UNAUTHORIZED, "No API key provided"));
    }

    log.debug("Requesting current weather for {}", city);
    return webClient.getAbs(config.baseUrl() + WEATHER_PATH)
      .addQueryParam("q", city)
      .addQueryParam("appid", key)
      .addQueryParam("units", "metric")
      .timeout(config.timeoutMs())
      .send()
      .recover(err -> Future.failedFuture(new ExternalLookupException(
        Reason.FAILED, "Weather service request failed: " + err.getMessage(), err)))
      .compose(response -> handleResponse(city, response))
      .onSuccess(weather -> log.info("Current weather for {}: {} C", weather.city(), weather.temperature()))
      .onFailure(err -> log.warn("Weather lookup for {} failed: {}", city, err.getMessage()));
  }

  @Override
  public Future<Void> close() {
    webClient.close();
    return Future.succeededFuture();
  }

  private Future<CurrentWeather> handleResponse(String city, HttpResponse<Buffer> response) {
    int status = response.statusCode();
    if (status == 401) {
      String message = errorMessage(response, "Invalid API key");
      return Future.failedFuture(new ExternalLookupException(Reason.UNAUTHORIZED, "Error 401: " + message));
    }
    if (status != 200) {
      String message = errorMessage(response, response.statusMessage());
      return Future.failedFuture(new ExternalLookupException(
        Reason.FAILED, "Error " + status + " looking up " + city + ": " + message));
    }

    try {
      return Future.succeededFuture(parse(response.bodyAsJsonObject()));
    } catch (DecodeException | ClassCastException e) {
      return Future.failedFuture(new ExternalLookupException(
        Reason.FAILED, "Malformed weather response for " + city, e));
    }
  }

  static CurrentWeather parse(JsonObject body) {
    if (body == null) {
      throw new DecodeException("Empty response body");
    }
    JsonObject main = body.getJsonObject("main");
    Double temperature = main == null ? null : main.getDouble("temp");
    if (temperature == null) {
      throw new DecodeException("Missing main.temp");
    }

    JsonObject wind = body.getJsonObject("wind");
    Double windSpeed = wind == null ? null : wind.getDouble("speed");

    JsonArray weather = body.getJsonArray("weather");
    String description = weather != null && !weather.isEmpty()
      ? weather.getJsonObject(0).getString("description", "")
      : "";

    return new CurrentWeather(
      body.getString("name", ""),
      temperature,
      windSpeed == null ? Double.NaN : windSpeed,
      description
    );
  }

  private static String errorMessage(HttpResponse<Buffer> response, String fallback) {
    try {
      JsonObject body = response.bodyAsJsonObject();
      if (body != null && body.getString("message") != null) {
        return body.getString("message");
      }
    } catch (DecodeException | ClassCastException e) {
      log.debug("Error response body is not JSON: {}", e.getMessage());
    }
    return fallback;
  }
}
