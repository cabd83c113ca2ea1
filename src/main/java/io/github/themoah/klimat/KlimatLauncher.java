package io.github.themoah.klimat;

import io.github.themoah.klimat.config.AnalysisConfig;
import io.github.themoah.klimat.config.VertxConfig;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launcher for the Klimat HTTP server.
 */
public class KlimatLauncher {

  private static final Logger log = LoggerFactory.getLogger(KlimatLauncher.class);

  public static void main(String[] args) {
    VertxConfig.useSlf4jLogging();

    VertxOptions vertxOptions = VertxConfig.createVertxOptions(AnalysisConfig.fromEnvironment());
    Vertx vertx = Vertx.vertx(vertxOptions);

    vertx.deployVerticle(new MainVerticle())
      .onSuccess(id -> log.info("MainVerticle deployed with ID: {}", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
