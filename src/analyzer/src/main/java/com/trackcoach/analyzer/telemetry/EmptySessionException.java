package com.trackcoach.analyzer.telemetry;

/** Raised when a driver's session has no usable sample at all. */
public class EmptySessionException extends TelemetryAnalysisException {
  private final String driverId;

  public EmptySessionException(String driverId, String message) {
    super(message);
    this.driverId = driverId;
  }

  public String getDriverId() {
    return driverId;
  }
}
