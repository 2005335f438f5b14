package com.trackcoach.analyzer.telemetry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One lap of a driver's session: samples ordered by timestamp.
 *
 * @param driverId driver identifier
 * @param lapNumber lap number assigned upstream
 * @param samples samples in chronological order
 * @param lapTimeS last timestamp minus first timestamp
 * @param bestLap true for the fastest eligible lap of the session
 */
public record Lap(
    @JsonProperty("driver_id") String driverId,
    @JsonProperty("lap_number") int lapNumber,
    @JsonIgnore List<Sample> samples,
    @JsonProperty("lap_time_s") double lapTimeS,
    @JsonProperty("is_best_lap") boolean bestLap) {

  public Lap {
    samples = List.copyOf(samples);
  }

  /**
   * Builds a lap and derives its lap time from the first and last sample.
   *
   * @param driverId driver identifier
   * @param lapNumber lap number
   * @param samples chronologically ordered samples
   * @return lap not flagged as best
   */
  public static Lap of(String driverId, int lapNumber, List<Sample> samples) {
    double lapTime = samples.isEmpty()
        ? 0.0
        : samples.get(samples.size() - 1).timestamp() - samples.get(0).timestamp();
    return new Lap(driverId, lapNumber, samples, lapTime, false);
  }

  public int size() {
    return samples.size();
  }

  public Sample sample(int index) {
    return samples.get(index);
  }

  Lap markBest() {
    return new Lap(driverId, lapNumber, samples, lapTimeS, true);
  }
}
