package io.github.themoah.klimat.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BooleanSupplier analysisLoaded;

  public HealthCheckHandler(BooleanSupplier analysisLoaded) {
    this.analysisLoaded = analysisLoaded;
  }

  /**
   * Registers health check routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(HealthCheckResponse.liveness().toJson().encode());
  }

  /**
   * Readiness probe. Returns 200 once the analysis result is loaded, 503 before.
   */
  private void handleReadiness(RoutingContext ctx) {
    boolean loaded = analysisLoaded.getAsBoolean();
    HealthCheckResponse response = HealthCheckResponse.readiness(loaded);

    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(loaded ? 200 : 503)
      .end(response.toJson().encode());
  }
}
