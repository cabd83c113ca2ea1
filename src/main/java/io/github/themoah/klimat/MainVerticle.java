package io.github.themoah.klimat;

import io.github.themoah.klimat.api.AnalysisRoutes;
import io.github.themoah.klimat.api.AnalysisState;
import io.github.themoah.klimat.config.AnalysisConfig;
import io.github.themoah.klimat.config.AppConfig;
import io.github.themoah.klimat.dataset.DatasetLoader;
import io.github.themoah.klimat.health.HealthCheckHandler;
import io.github.themoah.klimat.metrics.AnalysisMetrics;
import io.github.themoah.klimat.metrics.MetricsConfig;
import io.github.themoah.klimat.metrics.MicrometerConfig;
import io.github.themoah.klimat.metrics.PrometheusHandler;
import io.github.themoah.klimat.model.AnalysisResult;
import io.github.themoah.klimat.scheduler.ExecutionScheduler;
import io.github.themoah.klimat.stats.StatisticsAggregator;
import io.github.themoah.klimat.weather.LiveLookupService;
import io.github.themoah.klimat.weather.OpenWeatherMapClient;
import io.github.themoah.klimat.weather.WeatherClient;
import io.github.themoah.klimat.weather.WeatherConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for Klimat.
 * Starts the HTTP server, then loads the dataset and runs the analysis once.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final AnalysisConfig analysisConfig;
  private final MetricsConfig metricsConfig;
  private final WeatherConfig weatherConfig;

  private final AnalysisState state = new AnalysisState();
  private WeatherClient weatherClient;
  private HttpServer httpServer;

  public MainVerticle() {
    this(AppConfig.fromEnvironment(), AnalysisConfig.fromEnvironment(),
      MetricsConfig.fromEnvironment(), WeatherConfig.fromEnvironment());
  }

  public MainVerticle(
    AppConfig appConfig,
    AnalysisConfig analysisConfig,
    MetricsConfig metricsConfig,
    WeatherConfig weatherConfig
  ) {
    this.appConfig = appConfig;
    this.analysisConfig = analysisConfig;
    this.metricsConfig = metricsConfig;
    this.weatherConfig = weatherConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting Klimat MainVerticle");

    MeterRegistry registry = MicrometerConfig.createRegistry(metricsConfig);
    AnalysisMetrics metrics = new AnalysisMetrics(registry);
    weatherClient = new OpenWeatherMapClient(vertx, weatherConfig);

    Router router = Router.router(vertx);
    new HealthCheckHandler(state::isLoaded).registerRoutes(router);
    new AnalysisRoutes(state, new StatisticsAggregator(analysisConfig.rollingWindow()),
      new LiveLookupService(weatherClient)).registerRoutes(router);

    if (metricsConfig.isEnabled() && registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\":\"Not Found\"}");
    });

    startHttpServer(router, appConfig.httpPort())
      .compose(server -> {
        httpServer = server;
        return runAnalysis(metrics);
      })
      .onSuccess(result -> {
        log.info("Klimat started successfully on port {}", actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start Klimat", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping Klimat MainVerticle");

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    Future<Void> closeWeatherClient = (weatherClient != null)
      ? weatherClient.close()
      : Future.succeededFuture();

    stopHttpServer
      .compose(v -> closeWeatherClient)
      .onSuccess(v -> {
        log.info("Klimat stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during Klimat shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Port the HTTP server is bound to, or -1 before it is listening.
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  AnalysisState state() {
    return state;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private Future<AnalysisResult> runAnalysis(AnalysisMetrics metrics) {
    DatasetLoader loader = DatasetLoader.fromConfig(analysisConfig);
    ExecutionScheduler scheduler = new ExecutionScheduler(vertx, analysisConfig);
    log.info("Loading dataset: {}", loader.describe());

    return vertx.executeBlocking(() -> {
      long start = System.nanoTime();
      AnalysisResult result = scheduler.runSequential(loader.get());
      metrics.recordDuration("sequential", Duration.ofNanos(System.nanoTime() - start));
      return result;
    }, false)
      .onSuccess(result -> {
        state.publish(result);
        metrics.reportResult(result);
        log.info("Analysis loaded: cities={}, partitions={}, anomalies={}, warnings={}",
          result.cities().size(), result.stats().size(), result.anomalies().size(), result.warnings().size());
      })
      .onFailure(err -> log.error("Analysis failed", err));
  }
}
