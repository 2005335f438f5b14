package com.trackcoach.analyzer.telemetry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One telemetry reading as handed over by the loader boundary.
 *
 * <p>Sensor channels are boxed: {@code null} and {@code NaN} both mean "no reading" and are never
 * read as zero. {@code timestamp} is in seconds; samples with a non-finite timestamp or distance are
 * dropped by {@link LapSegmenter}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Sample(
  @JsonProperty("timestamp") double timestamp,
  @JsonProperty("distance_m") double distanceM,
  @JsonProperty("speed_kmh") Double speedKmh,
  @JsonProperty("steering_deg") Double steeringDeg,
  @JsonProperty("lateral_g") Double lateralG,
  @JsonProperty("longitudinal_g") Double longitudinalG,
  @JsonProperty("brake_front_bar") Double brakeFrontBar,
  @JsonProperty("throttle_pct") Double throttlePct,
  @JsonProperty("lap_number") int lapNumber
) {

  /**
   * Returns whether the sample can be placed on the time and distance axes.
   *
   * @return {@code false} when timestamp or distance is NaN or infinite
   */
  public boolean isWellFormed() {
    return Double.isFinite(timestamp) && Double.isFinite(distanceM);
  }
}
