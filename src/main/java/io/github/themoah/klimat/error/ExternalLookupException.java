package io.github.themoah.klimat.error;

/**
 * Raised when the live weather service cannot provide current conditions.
 */
public class ExternalLookupException extends AnalysisException {

  /**
   * Distinguishes credential problems from every other lookup failure.
   */
  public enum Reason {
    UNAUTHORIZED,
    FAILED
  }

  private final Reason reason;

  public ExternalLookupException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ExternalLookupException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isUnauthorized() {
    return reason == Reason.UNAUTHORIZED;
  }
}
