package io.github.themoah.klimat.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 */
public record AppConfig(int httpPort) {

  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>HTTP_PORT - HTTP server port (default: 8888)</li>
   * </ul>
   */
  public static AppConfig fromEnvironment() {
    return from(System.getenv());
  }

  static AppConfig from(Map<String, String> env) {
    int port = Env.getInt(env, "HTTP_PORT", DEFAULT_HTTP_PORT);

    log.info("AppConfig loaded: httpPort={}", port);
    return new AppConfig(port);
  }
}
