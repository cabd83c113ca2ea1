package io.github.themoah.klimat.error;

/**
 * Base type for failures raised by the analysis engine and its collaborators.
 */
public class AnalysisException extends RuntimeException {

  public AnalysisException(String message) {
    super(message);
  }

  public AnalysisException(String message, Throwable cause) {
    super(message, cause);
  }
}
