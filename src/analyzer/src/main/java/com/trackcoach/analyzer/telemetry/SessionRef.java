package com.trackcoach.analyzer.telemetry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identifies one driver's telemetry in one race.
 *
 * @param trackId track identifier (for example {@code barber})
 * @param raceNumber race number within the event
 * @param driverId driver or vehicle identifier
 */
public record SessionRef(
    @JsonProperty("track_id") String trackId,
    @JsonProperty("race_number") int raceNumber,
    @JsonProperty("driver_id") String driverId) {

  @Override
  public String toString() {
    return trackId + "/r" + raceNumber + "/" + driverId;
  }
}
