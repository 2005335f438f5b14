package com.trackcoach.analyzer.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Output of {@link LapSegmenter}: a driver's laps plus diagnostics.
 *
 * @param driverId driver identifier
 * @param laps laps ordered by lap number, exactly one flagged as best
 * @param skippedSamples samples dropped because timestamp or distance was not finite
 */
public record SegmentedSession(
    @JsonProperty("driver_id") String driverId,
    @JsonProperty("laps") List<Lap> laps,
    @JsonProperty("skipped_samples") int skippedSamples) {

  public SegmentedSession {
    laps = List.copyOf(laps);
  }

  public Optional<Lap> bestLap() {
    return laps.stream().filter(Lap::bestLap).findFirst();
  }
}
