package com.trackcoach.analyzer.compare;

import com.trackcoach.analyzer.config.DetectionConfig;
import com.trackcoach.analyzer.corner.CornerMetrics;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based coaching sentences for one aligned corner.
 *
 * <p>A metric is reported when its {@code |B - A|} delta exceeds the distance or speed threshold.
 * Sentences are ranked by the magnitude of a rough kinematic time estimate:
 * <ul>
 *   <li>speed metrics: one third of the corner length covered at the two speeds</li>
 *   <li>braking point: the delta distance covered at entry speed instead of mean braking speed</li>
 *   <li>throttle application: the delta distance covered at mean accelerating speed instead of exit speed</li>
 * </ul>
 * The estimate only orders sentences; it is not a lap-time model.
 */
final class InsightGenerator {
  private static final double KMH_PER_MS = 3.6;

  private InsightGenerator() {}

  static List<Insight> generate(
      String driverAId, String driverBId, CornerMetrics a, CornerMetrics b, DetectionConfig config) {
    List<Insight> insights = new ArrayList<>();
    double phaseM = Math.max(0.0, (a.zone().lengthM() + b.zone().lengthM()) / 2.0) / 3.0;

    Double braking = ComparedMetric.BRAKING_POINT.delta(a, b);
    if (braking != null && Math.abs(braking) > config.insightDistanceThresholdM()) {
      insights.add(new Insight(
          ComparedMetric.BRAKING_POINT,
          brakingImpact(braking, a, b),
          format("Driver %s brakes %.1fm %s than driver %s (%.1fm vs %.1fm)",
              driverBId, Math.abs(braking), braking > 0 ? "later" : "earlier", driverAId,
              a.brakingPointDistanceM(), b.brakingPointDistanceM())));
    }

    Double entry = ComparedMetric.ENTRY_SPEED.delta(a, b);
    if (entry != null && Math.abs(entry) > config.insightSpeedThresholdKmh()) {
      insights.add(new Insight(
          ComparedMetric.ENTRY_SPEED,
          speedImpact(phaseM, a.entrySpeedKmh(), b.entrySpeedKmh()),
          format("Driver %s carries %.1f km/h %s entry speed (%.1f vs %.1f km/h)",
              driverBId, Math.abs(entry), entry > 0 ? "more" : "less",
              a.entrySpeedKmh(), b.entrySpeedKmh())));
    }

    Double apex = ComparedMetric.APEX_SPEED.delta(a, b);
    if (apex != null && Math.abs(apex) > config.insightSpeedThresholdKmh()) {
      insights.add(new Insight(
          ComparedMetric.APEX_SPEED,
          speedImpact(phaseM, a.apexSpeedKmh(), b.apexSpeedKmh()),
          format("Driver %s is %.1f km/h %s at the apex (%.1f vs %.1f km/h)",
              driverBId, Math.abs(apex), apex > 0 ? "faster" : "slower",
              a.apexSpeedKmh(), b.apexSpeedKmh())));
    }

    Double exit = ComparedMetric.EXIT_SPEED.delta(a, b);
    if (exit != null && Math.abs(exit) > config.insightSpeedThresholdKmh()) {
      insights.add(new Insight(
          ComparedMetric.EXIT_SPEED,
          speedImpact(phaseM, a.exitSpeedKmh(), b.exitSpeedKmh()),
          format("Driver %s has %.1f km/h %s exit speed (%.1f vs %.1f km/h)",
              driverBId, Math.abs(exit), exit > 0 ? "higher" : "lower",
              a.exitSpeedKmh(), b.exitSpeedKmh())));
    }

    Double throttle = ComparedMetric.THROTTLE_APPLICATION.delta(a, b);
    if (throttle != null && Math.abs(throttle) > config.insightDistanceThresholdM()) {
      insights.add(new Insight(
          ComparedMetric.THROTTLE_APPLICATION,
          throttleImpact(throttle, a, b),
          format("Driver %s gets back on throttle %.1fm %s (%.1fm vs %.1fm)",
              driverBId, Math.abs(throttle), throttle > 0 ? "later" : "earlier",
              a.throttleApplicationDistanceM(), b.throttleApplicationDistanceM())));
    }

    // List.sort is stable: equal impacts keep metric order.
    insights.sort(Comparator.comparingDouble((Insight insight) -> Math.abs(insight.impactS())).reversed());
    return insights;
  }

  /**
   * One-line corner time sentence, or {@code null} below the time threshold.
   */
  static String summary(String driverBId, int cornerIndex, CornerMetrics a, CornerMetrics b, DetectionConfig config) {
    double delta = b.cornerTimeS() - a.cornerTimeS();
    if (!(Math.abs(delta) > config.insightTimeThresholdS())) {
      return null;
    }
    return format("Driver %s is %.2fs %s through corner %d (%.2fs vs %.2fs)",
        driverBId, Math.abs(delta), delta < 0 ? "faster" : "slower", cornerIndex,
        a.cornerTimeS(), b.cornerTimeS());
  }

  static double speedImpact(double distanceM, Double speedAKmh, Double speedBKmh) {
    if (!positive(speedAKmh) || !positive(speedBKmh)) {
      return 0.0;
    }
    return distanceM * (KMH_PER_MS / speedAKmh - KMH_PER_MS / speedBKmh);
  }

  static double brakingImpact(double deltaM, CornerMetrics a, CornerMetrics b) {
    Double entry = mean(a.entrySpeedKmh(), b.entrySpeedKmh());
    Double apex = mean(a.apexSpeedKmh(), b.apexSpeedKmh());
    if (!positive(entry) || !positive(apex)) {
      return 0.0;
    }
    double braking = (entry + apex) / 2.0;
    return deltaM * (KMH_PER_MS / braking - KMH_PER_MS / entry);
  }

  static double throttleImpact(double deltaM, CornerMetrics a, CornerMetrics b) {
    Double apex = mean(a.apexSpeedKmh(), b.apexSpeedKmh());
    Double exit = mean(a.exitSpeedKmh(), b.exitSpeedKmh());
    if (!positive(apex) || !positive(exit)) {
      return 0.0;
    }
    double accelerating = (apex + exit) / 2.0;
    return -deltaM * (KMH_PER_MS / accelerating - KMH_PER_MS / exit);
  }

  private static Double mean(Double first, Double second) {
    if (first == null || second == null) {
      return null;
    }
    return (first + second) / 2.0;
  }

  private static boolean positive(Double value) {
    return value != null && value > 0;
  }

  private static String format(String template, Object... args) {
    return String.format(Locale.ROOT, template, args);
  }
}
