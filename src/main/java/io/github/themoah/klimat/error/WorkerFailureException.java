package io.github.themoah.klimat.error;

/**
 * Aggregated failure of a parallel detection batch.
 *
 * <p>The first observed failure is the cause; failures of other workers in the
 * same batch are attached as suppressed exceptions. No partial result accompanies it.
 */
public class WorkerFailureException extends AnalysisException {

  public WorkerFailureException(String message) {
    super(message);
  }

  public WorkerFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
