package io.github.themoah.klimat.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param analysis analysis state, "loaded" or "loading" (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String analysis
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response reflecting whether the analysis result is available.
   *
   * @param analysisLoaded true once the startup analysis has completed
   */
  public static HealthCheckResponse readiness(boolean analysisLoaded) {
    HealthStatus status = analysisLoaded ? HealthStatus.UP : HealthStatus.DOWN;
    return new HealthCheckResponse(status, analysisLoaded ? "loaded" : "loading");
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (analysis != null) {
      json.put("analysis", analysis);
    }
    return json;
  }
}
