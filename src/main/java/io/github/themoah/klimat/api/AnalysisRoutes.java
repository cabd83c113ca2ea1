package io.github.themoah.klimat.api;

import io.github.themoah.klimat.error.ExternalLookupException;
import io.github.themoah.klimat.model.AnalysisResult;
import io.github.themoah.klimat.model.AnomalyRecord;
import io.github.themoah.klimat.model.Observation;
import io.github.themoah.klimat.model.Season;
import io.github.themoah.klimat.model.SeasonalStat;
import io.github.themoah.klimat.stats.StatisticsAggregator;
import io.github.themoah.klimat.weather.LiveLookupService;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only HTTP API over the loaded analysis result, plus the live weather comparison.
 */
public class AnalysisRoutes {

  private static final Logger log = LoggerFactory.getLogger(AnalysisRoutes.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  static final String API_KEY_HEADER = "X-Api-Key";

  private final AnalysisState state;
  private final StatisticsAggregator aggregator;
  private final LiveLookupService lookupService;

  public AnalysisRoutes(AnalysisState state, StatisticsAggregator aggregator, LiveLookupService lookupService) {
    this.state = Objects.requireNonNull(state, "state cannot be null");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator cannot be null");
    this.lookupService = Objects.requireNonNull(lookupService, "lookupService cannot be null");
  }

  public void registerRoutes(Router router) {
    router.get("/api/cities").handler(this::handleCities);
    router.get("/api/cities/:city/stats").handler(this::handleStats);
    router.get("/api/cities/:city/anomalies").handler(this::handleAnomalies);
    router.get("/api/cities/:city/observations").handler(this::handleObservations);
    router.get("/api/cities/:city/profile").handler(this::handleProfile);
    router.get("/api/cities/:city/current").handler(this::handleCurrent);
    log.info("Analysis routes registered under /api/cities");
  }

  private void handleCities(RoutingContext ctx) {
    AnalysisResult result = requireResult(ctx);
    if (result == null) {
      return;
    }
    sendJson(ctx, 200, new JsonObject().put("cities", new JsonArray(result.cities())));
  }

  private void handleStats(RoutingContext ctx) {
    AnalysisResult result = requireResult(ctx);
    String city = result == null ? null : requireCity(ctx, result);
    if (city == null) {
      return;
    }
    JsonArray stats = new JsonArray();
    for (SeasonalStat stat : result.statsFor(city)) {
      stats.add(JsonMapper.stat(stat));
    }
    sendJson(ctx, 200, new JsonObject().put("city", city).put("stats", stats));
  }

  private void handleAnomalies(RoutingContext ctx) {
    AnalysisResult result = requireResult(ctx);
    String city = result == null ? null : requireCity(ctx, result);
    if (city == null) {
      return;
    }
    List<AnomalyRecord> anomalies = result.anomaliesFor(city);
    JsonArray items = new JsonArray();
    for (AnomalyRecord anomaly : anomalies) {
      items.add(JsonMapper.anomaly(anomaly));
    }
    sendJson(ctx, 200, new JsonObject()
      .put("city", city)
      .put("count", anomalies.size())
      .put("anomalies", items));
  }

  private void handleObservations(RoutingContext ctx) {
    AnalysisResult result = requireResult(ctx);
    String city = result == null ? null : requireCity(ctx, result);
    if (city == null) {
      return;
    }
    JsonArray items = new JsonArray();
    for (Observation observation : result.observationsFor(city)) {
      items.add(JsonMapper.observation(observation));
    }
    sendJson(ctx, 200, new JsonObject().put("city", city).put("observations", items));
  }

  private void handleProfile(RoutingContext ctx) {
    AnalysisResult result = requireResult(ctx);
    String city = result == null ? null : requireCity(ctx, result);
    if (city == null) {
      return;
    }
    sendJson(ctx, 200, JsonMapper.profile(aggregator.computeDayOfYearProfile(result.observations(), city)));
  }

  private void handleCurrent(RoutingContext ctx) {
    AnalysisResult result = requireResult(ctx);
    String city = result == null ? null : requireCity(ctx, result);
    if (city == null) {
      return;
    }

    Season season = null;
    String seasonParam = ctx.request().getParam("season");
    if (seasonParam != null && !seasonParam.isBlank()) {
      try {
        season = Season.fromLabel(seasonParam);
      } catch (IllegalArgumentException e) {
        sendError(ctx, 400, e.getMessage());
        return;
      }
    }

    lookupService.lookup(city, season, ctx.request().getHeader(API_KEY_HEADER), result)
      .onSuccess(comparison -> sendJson(ctx, 200, JsonMapper.comparison(comparison)))
      .onFailure(err -> {
        if (err instanceof ExternalLookupException lookupError) {
          sendError(ctx, lookupError.isUnauthorized() ? 401 : 502, lookupError.getMessage());
        } else if (err instanceof IllegalArgumentException) {
          sendError(ctx, 404, err.getMessage());
        } else {
          log.error("Live lookup for {} failed", city, err);
          sendError(ctx, 500, "Internal error");
        }
      });
  }

  private AnalysisResult requireResult(RoutingContext ctx) {
    AnalysisResult result = state.current().orElse(null);
    if (result == null) {
      sendError(ctx, 503, "Analysis not loaded yet");
    }
    return result;
  }

  private String requireCity(RoutingContext ctx, AnalysisResult result) {
    String city = ctx.pathParam("city");
    if (city == null || !result.cities().contains(city)) {
      sendError(ctx, 404, "Unknown city: " + city);
      return null;
    }
    return city;
  }

  private static void sendJson(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }

  private static void sendError(RoutingContext ctx, int status, String message) {
    sendJson(ctx, status, new JsonObject().put("error", message));
  }
}
