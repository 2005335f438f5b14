package com.trackcoach.analyzer.corner;

import com.trackcoach.analyzer.config.DetectionConfig;
import com.trackcoach.analyzer.telemetry.EmptyInputException;
import com.trackcoach.analyzer.telemetry.Lap;
import com.trackcoach.analyzer.telemetry.Sample;
import com.trackcoach.analyzer.telemetry.Signals;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Computes entry/apex/exit speeds and driver-input metrics for detected corner zones.
 *
 * <p>The braking point is searched in a window of samples immediately before the zone, clamped at
 * the lap start. Throttle application is searched from the apex to the zone end plus an optional
 * overrun, clamped at the lap end.
 */
@Component
public class CornerMetricsExtractor {

  /**
   * Extracts metrics for every zone of a lap.
   *
   * @param lap lap the zones were detected on
   * @param zones zones in lap order
   * @param config search windows and thresholds
   * @return metrics in the same order as {@code zones}
   */
  public List<CornerMetrics> extractAll(Lap lap, List<CornerZone> zones, DetectionConfig config) {
    List<CornerMetrics> metrics = new ArrayList<>(zones.size());
    for (CornerZone zone : zones) {
      metrics.add(extract(lap, zone, config));
    }
    return metrics;
  }

  /**
   * Extracts the metrics of one zone.
   *
   * @param lap lap the zone was detected on
   * @param zone zone whose indices are valid for {@code lap}
   * @param config search windows and thresholds
   * @return corner metrics, with {@code null} for metrics whose channel is missing
   * @throws EmptyInputException when the lap has no samples
   */
  public CornerMetrics extract(Lap lap, CornerZone zone, DetectionConfig config) {
    if (lap.size() == 0) {
      throw new EmptyInputException(
          "lap " + lap.lapNumber() + " of driver " + lap.driverId() + " has no samples");
    }
    if (zone.endIdx() >= lap.size()) {
      throw new IllegalArgumentException(
          "zone " + zone.zoneIndex() + " ends at " + zone.endIdx() + " beyond lap size " + lap.size());
    }

    List<Sample> samples = lap.samples();
    int start = zone.startIdx();
    int end = zone.endIdx();
    Sample entry = samples.get(start);
    Sample exit = samples.get(end);

    int windowStart = Math.max(0, start - config.brakingLookbackSamples());
    int windowEnd = start - 1;
    Double brakingPoint = null;
    Double brakeMax = null;
    if (windowEnd >= windowStart) {
      brakingPoint = firstDistanceAbove(
          samples, windowStart, windowEnd, Sample::brakeFrontBar, config.brakePressureThresholdBar());
      brakeMax = Signals.max(samples, windowStart, windowEnd, Sample::brakeFrontBar);
    }

    int throttleEnd = Math.min(samples.size() - 1, end + config.throttleOverrunSamples());
    Double throttlePoint = firstDistanceAbove(
        samples, zone.apexIdx(), throttleEnd, Sample::throttlePct, config.throttleThresholdPct());

    return new CornerMetrics(
        zone,
        Signals.orNull(entry.speedKmh()),
        Signals.orNull(samples.get(zone.apexIdx()).speedKmh()),
        Signals.orNull(exit.speedKmh()),
        exit.timestamp() - entry.timestamp(),
        Signals.maxAbs(samples, start, end, Sample::lateralG),
        Signals.maxAbs(samples, start, end, Sample::steeringDeg),
        Signals.populationStdDev(samples, start, end, Sample::steeringDeg),
        brakingPoint,
        brakeMax,
        throttlePoint);
  }

  private static Double firstDistanceAbove(
      List<Sample> samples,
      int from,
      int to,
      Function<Sample, Double> channel,
      double threshold) {
    for (int i = from; i <= to; i++) {
      Sample sample = samples.get(i);
      if (Signals.exceeds(channel.apply(sample), threshold)) {
        return sample.distanceM();
      }
    }
    return null;
  }
}
