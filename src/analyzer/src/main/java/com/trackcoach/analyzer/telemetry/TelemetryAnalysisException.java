package com.trackcoach.analyzer.telemetry;

/**
 * Base type for structural input failures raised by the analysis pipeline.
 *
 * <p>Missing sensor channels and malformed samples are not failures: they degrade the affected
 * metrics to {@code null} or are skipped and counted.
 */
public class TelemetryAnalysisException extends RuntimeException {
  /**
   * Creates an analysis exception.
   *
   * @param message description of the structurally unusable input
   */
  public TelemetryAnalysisException(String message) {
    super(message);
  }
}
