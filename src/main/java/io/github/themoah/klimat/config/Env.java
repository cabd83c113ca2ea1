package io.github.themoah.klimat.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed lookups over an environment-variable map, falling back to defaults on blank or invalid values.
 */
public final class Env {

  private static final Logger log = LoggerFactory.getLogger(Env.class);

  private Env() {}

  public static String getString(Map<String, String> env, String name, String defaultValue) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return value.trim();
  }

  public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public static int getInt(Map<String, String> env, String name, int defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  public static long getLong(Map<String, String> env, String name, long defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  /**
   * Like {@link #getInt} but also rejects values below {@code min}.
   */
  public static int getIntAtLeast(Map<String, String> env, String name, int min, int defaultValue) {
    int value = getInt(env, name, defaultValue);
    if (value < min) {
      log.warn("{} must be >= {}, got {}, using default: {}", name, min, value, defaultValue);
      return defaultValue;
    }
    return value;
  }
}
