package io.github.themoah.klimat.error;

/**
 * Raised when input records are missing a required column or carry a malformed value.
 * Input is rejected as a whole before any aggregation runs.
 */
public class InputSchemaException extends AnalysisException {

  private final long lineNumber;

  public InputSchemaException(String message) {
    this(message, -1);
  }

  public InputSchemaException(String message, long lineNumber) {
    super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message);
    this.lineNumber = lineNumber;
  }

  public InputSchemaException(String message, long lineNumber, Throwable cause) {
    super(lineNumber > 0 ? "Line " + lineNumber + ": " + message : message, cause);
    this.lineNumber = lineNumber;
  }

  /**
   * Returns the 1-based line the problem was found on, or -1 when not line-specific.
   */
  public long lineNumber() {
    return lineNumber;
  }
}
