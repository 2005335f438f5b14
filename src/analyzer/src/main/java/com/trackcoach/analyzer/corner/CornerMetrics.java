package com.trackcoach.analyzer.corner;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived performance metrics for one corner zone.
 *
 * <p>A metric is {@code null} when its source channel has no reading over the relevant samples;
 * no sentinel numbers are used.
 *
 * @param zone zone the metrics were computed for
 * @param entrySpeedKmh speed at the zone start
 * @param apexSpeedKmh speed at the apex
 * @param exitSpeedKmh speed at the zone end
 * @param cornerTimeS time from zone start to zone end
 * @param lateralGMax maximum |lateral g| in the zone
 * @param steeringAngleMaxDeg maximum |steering angle| in the zone
 * @param steeringSmoothness population standard deviation of steering angle in the zone
 * @param brakingPointDistanceM distance where brake pressure first crosses the threshold
 * @param brakePressureMaxBar maximum brake pressure over the braking lookback window
 * @param throttleApplicationDistanceM distance where throttle first crosses the threshold after the apex
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CornerMetrics(
    @JsonProperty("zone") CornerZone zone,
    @JsonProperty("entry_speed_kmh") Double entrySpeedKmh,
    @JsonProperty("apex_speed_kmh") Double apexSpeedKmh,
    @JsonProperty("exit_speed_kmh") Double exitSpeedKmh,
    @JsonProperty("corner_time_s") double cornerTimeS,
    @JsonProperty("lateral_g_max") Double lateralGMax,
    @JsonProperty("steering_angle_max_deg") Double steeringAngleMaxDeg,
    @JsonProperty("steering_smoothness") Double steeringSmoothness,
    @JsonProperty("braking_point_distance_m") Double brakingPointDistanceM,
    @JsonProperty("brake_pressure_max_bar") Double brakePressureMaxBar,
    @JsonProperty("throttle_application_distance_m") Double throttleApplicationDistanceM) {

  public int zoneIndex() {
    return zone.zoneIndex();
  }
}
