package com.trackcoach.analyzer.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analyses of all requested drivers in one race.
 *
 * @param trackId track identifier
 * @param raceNumber race number
 * @param drivers analyses keyed by driver, in request order
 * @param skippedDrivers drivers that could not be analyzed, with the reason
 */
public record RaceAnalysis(
    @JsonProperty("track_id") String trackId,
    @JsonProperty("race_number") int raceNumber,
    @JsonProperty("drivers") Map<String, DriverAnalysis> drivers,
    @JsonProperty("skipped_drivers") Map<String, String> skippedDrivers) {

  public RaceAnalysis {
    drivers = Collections.unmodifiableMap(new LinkedHashMap<>(drivers));
    skippedDrivers = Collections.unmodifiableMap(new LinkedHashMap<>(skippedDrivers));
  }
}
