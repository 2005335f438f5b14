package com.trackcoach.analyzer.corner;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A detected corner inside one lap, expressed as indices into the lap's sample list.
 *
 * <p>{@code zoneIndex} is a per-lap ordinal starting at 1, not an official track corner number.
 *
 * @param zoneIndex sequential index by ascending start
 * @param startIdx first sample of the zone
 * @param apexIdx sample with the lowest speed inside the zone
 * @param endIdx last sample of the zone, inclusive
 * @param durationS timestamp span between start and end samples
 * @param startDistanceM lap distance at the start sample
 * @param apexDistanceM lap distance at the apex sample
 * @param endDistanceM lap distance at the end sample
 */
public record CornerZone(
    @JsonProperty("zone_index") int zoneIndex,
    @JsonProperty("start_idx") int startIdx,
    @JsonProperty("apex_idx") int apexIdx,
    @JsonProperty("end_idx") int endIdx,
    @JsonProperty("duration_s") double durationS,
    @JsonProperty("start_distance_m") double startDistanceM,
    @JsonProperty("apex_distance_m") double apexDistanceM,
    @JsonProperty("end_distance_m") double endDistanceM) {

  public CornerZone {
    if (startIdx < 0 || apexIdx < startIdx || endIdx < apexIdx) {
      throw new IllegalArgumentException(
          "Invalid zone indices: start=" + startIdx + ", apex=" + apexIdx + ", end=" + endIdx);
    }
  }

  public int sampleCount() {
    return endIdx - startIdx + 1;
  }

  public double lengthM() {
    return endDistanceM - startDistanceM;
  }
}
