package com.trackcoach.analyzer.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Corner analysis of every lap of one driver's session.
 *
 * @param driverId driver identifier
 * @param laps per-lap results ordered by lap number
 * @param bestLapNumber lap number flagged as best
 * @param skippedSamples malformed samples dropped during segmentation
 * @param missingChannels sensor channels with no reading anywhere in the session
 * @param failedLaps lap numbers whose analysis failed
 */
public record DriverAnalysis(
    @JsonProperty("driver_id") String driverId,
    @JsonProperty("laps") List<LapAnalysis> laps,
    @JsonProperty("best_lap_number") int bestLapNumber,
    @JsonProperty("skipped_samples") int skippedSamples,
    @JsonProperty("missing_channels") List<String> missingChannels,
    @JsonProperty("failed_laps") List<Integer> failedLaps) {

  public DriverAnalysis {
    laps = List.copyOf(laps);
    missingChannels = List.copyOf(missingChannels);
    failedLaps = List.copyOf(failedLaps);
  }

  public Optional<LapAnalysis> bestLap() {
    return laps.stream().filter(lap -> lap.lapNumber() == bestLapNumber).findFirst();
  }
}
