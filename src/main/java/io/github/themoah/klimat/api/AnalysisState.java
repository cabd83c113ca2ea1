package io.github.themoah.klimat.api;

import io.github.themoah.klimat.model.AnalysisResult;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the analysis result served over HTTP. Empty until the startup analysis completes,
 * then set exactly once.
 */
public class AnalysisState {

  private final AtomicReference<AnalysisResult> result = new AtomicReference<>();

  public Optional<AnalysisResult> current() {
    return Optional.ofNullable(result.get());
  }

  public boolean isLoaded() {
    return result.get() != null;
  }

  /**
   * Publishes the result.
   *
   * @throws IllegalStateException if a result was already published
   */
  public void publish(AnalysisResult analysisResult) {
    if (!result.compareAndSet(null, analysisResult)) {
      throw new IllegalStateException("Analysis result already published");
    }
  }
}
