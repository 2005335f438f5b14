package com.trackcoach.analyzer.telemetry;

/**
 * Raised when a lap handed to corner detection or extraction has no samples.
 *
 * <p>Callers processing a batch catch it per lap so the remaining laps still get analyzed.
 */
public class EmptyInputException extends TelemetryAnalysisException {
  public EmptyInputException(String message) {
    super(message);
  }
}
