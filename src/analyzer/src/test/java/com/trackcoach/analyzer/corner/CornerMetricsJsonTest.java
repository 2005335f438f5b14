package com.trackcoach.analyzer.corner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class CornerMetricsJsonTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parsesSnakeCasePayloadAndIgnoresUnknownFields() throws Exception {
    String payload = """
        {
          "zone": {
            "zone_index": 2,
            "start_idx": 310,
            "apex_idx": 355,
            "end_idx": 402,
            "duration_s": 3.125,
            "start_distance_m": 1204.5,
            "apex_distance_m": 1251.0,
            "end_distance_m": 1299.25
          },
          "entry_speed_kmh": 131.4,
          "apex_speed_kmh": 88.2,
          "exit_speed_kmh": 117.9,
          "corner_time_s": 3.125,
          "lateral_g_max": 1.34,
          "steering_angle_max_deg": 62.0,
          "steering_smoothness": 14.7,
          "braking_point_distance_m": 1150.0,
          "brake_pressure_max_bar": 41.5,
          "throttle_application_distance_m": null,
          "vehicle_class": "ignored"
        }
        """;

    CornerMetrics metrics = objectMapper.readValue(payload, CornerMetrics.class);

    assertThat(metrics.zoneIndex()).isEqualTo(2);
    assertThat(metrics.zone().startIdx()).isEqualTo(310);
    assertThat(metrics.zone().apexIdx()).isEqualTo(355);
    assertThat(metrics.zone().endIdx()).isEqualTo(402);
    assertThat(metrics.zone().lengthM()).isCloseTo(94.75, within(1e-6));
    assertThat(metrics.entrySpeedKmh()).isEqualTo(131.4);
    assertThat(metrics.apexSpeedKmh()).isEqualTo(88.2);
    assertThat(metrics.exitSpeedKmh()).isEqualTo(117.9);
    assertThat(metrics.cornerTimeS()).isEqualTo(3.125);
    assertThat(metrics.lateralGMax()).isEqualTo(1.34);
    assertThat(metrics.steeringAngleMaxDeg()).isEqualTo(62.0);
    assertThat(metrics.steeringSmoothness()).isEqualTo(14.7);
    assertThat(metrics.brakingPointDistanceM()).isEqualTo(1150.0);
    assertThat(metrics.brakePressureMaxBar()).isEqualTo(41.5);
    assertThat(metrics.throttleApplicationDistanceM()).isNull();
  }

  @Test
  void serializesUsingContractFieldNamesAndKeepsMissingMetricsAsNull() throws Exception {
    CornerZone zone = new CornerZone(1, 104, 180, 246, 5.2, 104.0, 180.0, 246.0);
    CornerMetrics metrics = new CornerMetrics(
        zone, 121.7, 90.0, 112.0, 5.2, null, 45.0, 12.3, 60.0, 30.0, 200.0);

    String json = objectMapper.writeValueAsString(metrics);
    JsonNode tree = objectMapper.readTree(json);
    CornerMetrics parsed = objectMapper.readValue(json, CornerMetrics.class);

    assertThat(tree.has("entry_speed_kmh")).isTrue();
    assertThat(tree.has("braking_point_distance_m")).isTrue();
    assertThat(tree.get("zone").has("apex_idx")).isTrue();
    assertThat(tree.get("lateral_g_max").isNull()).isTrue();
    assertThat(tree.has("entrySpeedKmh")).isFalse();
    assertThat(tree.has("zoneIndex")).isFalse();
    assertThat(parsed.zone()).isEqualTo(zone);
    assertThat(parsed.entrySpeedKmh()).isCloseTo(121.7, within(1e-6));
    assertThat(parsed.cornerTimeS()).isCloseTo(5.2, within(1e-6));
    assertThat(parsed.lateralGMax()).isNull();
    assertThat(parsed.throttleApplicationDistanceM()).isCloseTo(200.0, within(1e-6));
  }
}
