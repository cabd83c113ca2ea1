package io.github.themoah.klimat.health;

/**
 * Health status of the server or of the loaded analysis.
 */
public enum HealthStatus {
  UP("UP"),
  DOWN("DOWN");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
