package com.trackcoach.analyzer.compare;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Full comparison of two drivers' corner lists.
 *
 * @param driverAId reference driver
 * @param driverBId compared driver
 * @param corners per-corner results in lap order
 * @param unmatchedCorners corners present on only one side and left out of the comparison
 * @param expectedLapTimeGainS sum of corner time deltas, negative when B is faster overall
 * @param estimateMethod how the gain was computed ({@code naive_additive})
 * @param notes explanatory notes about the estimate and its limits
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DriverComparison(
    @JsonProperty("driver_a_id") String driverAId,
    @JsonProperty("driver_b_id") String driverBId,
    @JsonProperty("corners") List<ComparisonResult> corners,
    @JsonProperty("unmatched_corners") int unmatchedCorners,
    @JsonProperty("expected_lap_time_gain_s") double expectedLapTimeGainS,
    @JsonProperty("estimate_method") String estimateMethod,
    @JsonProperty("notes") Map<String, String> notes) {

  public DriverComparison {
    corners = List.copyOf(corners);
    notes = notes == null ? Map.of() : Map.copyOf(notes);
  }
}
