package com.trackcoach.analyzer.compare;

import com.trackcoach.analyzer.config.DetectionConfig;
import com.trackcoach.analyzer.corner.CornerMetrics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Compares two drivers corner by corner, usually on each driver's best lap.
 *
 * <p>Corners are aligned by position in their lists. When the lists differ in length only the
 * common prefix is compared and the remainder is reported as unmatched.
 */
@Component
public class DriverComparator {
  public static final String ESTIMATE_METHOD = "naive_additive";

  /**
   * Compares driver B against driver A.
   *
   * @param driverAId reference driver
   * @param cornersA reference driver's corners in lap order
   * @param driverBId compared driver
   * @param cornersB compared driver's corners in lap order
   * @param config insight thresholds
   * @return per-corner results plus the summed corner time delta
   */
  public DriverComparison compare(
      String driverAId,
      List<CornerMetrics> cornersA,
      String driverBId,
      List<CornerMetrics> cornersB,
      DetectionConfig config) {
    int aligned = Math.min(cornersA.size(), cornersB.size());
    List<ComparisonResult> results = new ArrayList<>(aligned);
    double gain = 0.0;
    for (int i = 0; i < aligned; i++) {
      ComparisonResult result =
          compareCorner(driverAId, cornersA.get(i), driverBId, cornersB.get(i), i + 1, config);
      gain += result.cornerTimeDeltaS();
      results.add(result);
    }

    Map<String, String> notes = new LinkedHashMap<>();
    notes.put(
        "expected_lap_time_gain_s",
        "Naive additive estimate: sum of per-corner time deltas (B - A). Not a validated predictive model.");
    notes.put("alignment", "Corners matched by position; indices are per-lap ordinals, not official corner numbers.");
    if (cornersA.size() != cornersB.size()) {
      notes.put(
          "unmatched",
          "Corner counts differ (" + cornersA.size() + " vs " + cornersB.size()
              + "); only the first " + aligned + " corners were compared.");
    }

    return new DriverComparison(
        driverAId,
        driverBId,
        results,
        Math.abs(cornersA.size() - cornersB.size()),
        gain,
        ESTIMATE_METHOD,
        notes);
  }

  ComparisonResult compareCorner(
      String driverAId,
      CornerMetrics a,
      String driverBId,
      CornerMetrics b,
      int cornerIndex,
      DetectionConfig config) {
    List<String> insights = InsightGenerator.generate(driverAId, driverBId, a, b, config).stream()
        .map(Insight::text)
        .toList();
    return new ComparisonResult(
        driverAId,
        driverBId,
        cornerIndex,
        ComparedMetric.BRAKING_POINT.delta(a, b),
        ComparedMetric.ENTRY_SPEED.delta(a, b),
        ComparedMetric.APEX_SPEED.delta(a, b),
        ComparedMetric.EXIT_SPEED.delta(a, b),
        ComparedMetric.THROTTLE_APPLICATION.delta(a, b),
        b.cornerTimeS() - a.cornerTimeS(),
        ComparedMetric.LATERAL_G_MAX.delta(a, b),
        ComparedMetric.STEERING_SMOOTHNESS.delta(a, b),
        insights,
        InsightGenerator.summary(driverBId, cornerIndex, a, b, config));
  }
}
