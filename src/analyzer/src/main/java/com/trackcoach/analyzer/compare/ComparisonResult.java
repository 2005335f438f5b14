package com.trackcoach.analyzer.compare;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Comparison of one aligned corner between two drivers. Every delta is {@code B - A}.
 *
 * @param driverAId reference driver
 * @param driverBId compared driver
 * @param cornerIndex ordinal of the corner after alignment, starting at 1
 * @param brakingPointDeltaM braking point delta, positive when B brakes later
 * @param entrySpeedDeltaKmh entry speed delta
 * @param apexSpeedDeltaKmh apex speed delta
 * @param exitSpeedDeltaKmh exit speed delta
 * @param throttleApplicationDeltaM throttle application delta, positive when B is later on throttle
 * @param cornerTimeDeltaS corner time delta, negative when B is faster
 * @param lateralGMaxDelta peak lateral g delta
 * @param steeringSmoothnessDelta steering standard deviation delta, negative when B is smoother
 * @param insights coaching sentences, highest estimated impact first
 * @param summary corner time sentence, {@code null} when the delta is below threshold
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComparisonResult(
    @JsonProperty("driver_a_id") String driverAId,
    @JsonProperty("driver_b_id") String driverBId,
    @JsonProperty("corner_index") int cornerIndex,
    @JsonProperty("braking_point_delta_m") Double brakingPointDeltaM,
    @JsonProperty("entry_speed_delta_kmh") Double entrySpeedDeltaKmh,
    @JsonProperty("apex_speed_delta_kmh") Double apexSpeedDeltaKmh,
    @JsonProperty("exit_speed_delta_kmh") Double exitSpeedDeltaKmh,
    @JsonProperty("throttle_application_delta_m") Double throttleApplicationDeltaM,
    @JsonProperty("corner_time_delta_s") double cornerTimeDeltaS,
    @JsonProperty("lateral_g_max_delta") Double lateralGMaxDelta,
    @JsonProperty("steering_smoothness_delta") Double steeringSmoothnessDelta,
    @JsonProperty("insights") List<String> insights,
    @JsonProperty("summary") String summary) {

  public ComparisonResult {
    insights = insights == null ? List.of() : List.copyOf(insights);
  }

  /**
   * Looks up a delta by metric.
   *
   * @param metric compared metric
   * @return signed delta, or {@code null} when either driver lacks the metric
   */
  public Double delta(ComparedMetric metric) {
    return switch (metric) {
      case BRAKING_POINT -> brakingPointDeltaM;
      case ENTRY_SPEED -> entrySpeedDeltaKmh;
      case APEX_SPEED -> apexSpeedDeltaKmh;
      case EXIT_SPEED -> exitSpeedDeltaKmh;
      case THROTTLE_APPLICATION -> throttleApplicationDeltaM;
      case CORNER_TIME -> Double.valueOf(cornerTimeDeltaS);
      case LATERAL_G_MAX -> lateralGMaxDelta;
      case STEERING_SMOOTHNESS -> steeringSmoothnessDelta;
    };
  }
}
