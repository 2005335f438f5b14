package com.trackcoach.analyzer.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trackcoach.analyzer.corner.CornerMetrics;
import com.trackcoach.analyzer.corner.CornerZone;
import java.util.List;

/**
 * Corner analysis of one lap.
 *
 * @param lapNumber lap number
 * @param lapTimeS lap duration in seconds
 * @param bestLap whether this is the driver's best lap
 * @param sampleCount number of samples in the lap
 * @param zones detected corner zones
 * @param corners metrics per zone, same order as {@code zones}
 * @param error failure description when the lap could not be analyzed, otherwise {@code null}
 */
public record LapAnalysis(
    @JsonProperty("lap_number") int lapNumber,
    @JsonProperty("lap_time_s") double lapTimeS,
    @JsonProperty("is_best_lap") boolean bestLap,
    @JsonProperty("sample_count") int sampleCount,
    @JsonProperty("zones") List<CornerZone> zones,
    @JsonProperty("corners") List<CornerMetrics> corners,
    @JsonProperty("error") String error) {

  public LapAnalysis {
    zones = List.copyOf(zones);
    corners = List.copyOf(corners);
  }

  @JsonIgnore
  public boolean isFailed() {
    return error != null;
  }
}
