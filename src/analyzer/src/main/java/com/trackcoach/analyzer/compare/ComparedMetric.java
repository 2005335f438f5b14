package com.trackcoach.analyzer.compare;

import com.trackcoach.analyzer.corner.CornerMetrics;
import java.util.function.Function;

/** Corner metrics that get a signed {@code B - A} delta in a comparison. */
public enum ComparedMetric {
  BRAKING_POINT(CornerMetrics::brakingPointDistanceM),
  ENTRY_SPEED(CornerMetrics::entrySpeedKmh),
  APEX_SPEED(CornerMetrics::apexSpeedKmh),
  EXIT_SPEED(CornerMetrics::exitSpeedKmh),
  THROTTLE_APPLICATION(CornerMetrics::throttleApplicationDistanceM),
  CORNER_TIME(metrics -> metrics.cornerTimeS()),
  LATERAL_G_MAX(CornerMetrics::lateralGMax),
  STEERING_SMOOTHNESS(CornerMetrics::steeringSmoothness);

  private final Function<CornerMetrics, Double> accessor;

  ComparedMetric(Function<CornerMetrics, Double> accessor) {
    this.accessor = accessor;
  }

  public Double valueOf(CornerMetrics metrics) {
    return accessor.apply(metrics);
  }

  /**
   * Signed difference {@code b - a}.
   *
   * @return difference, or {@code null} when either side has no value
   */
  public Double delta(CornerMetrics a, CornerMetrics b) {
    Double valueA = valueOf(a);
    Double valueB = valueOf(b);
    if (valueA == null || valueB == null || valueA.isNaN() || valueB.isNaN()) {
      return null;
    }
    return valueB - valueA;
  }
}
