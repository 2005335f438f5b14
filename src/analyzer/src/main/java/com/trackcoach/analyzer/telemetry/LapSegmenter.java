package com.trackcoach.analyzer.telemetry;

import com.trackcoach.analyzer.config.DetectionConfig;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Groups a driver's lap-tagged sample stream into {@link Lap}s and flags the best one.
 *
 * <p>Lap boundaries come from {@link Sample#lapNumber()}; distance wraparound is not inspected.
 */
@Component
public class LapSegmenter {

  /**
   * Segments a session.
   *
   * @param driverId driver the samples belong to
   * @param samples session samples in any order
   * @param config supplies the minimum sample count for best-lap candidacy
   * @return laps ordered by lap number plus the malformed-sample count
   * @throws EmptySessionException when no sample, or no well-formed sample, is supplied
   */
  public SegmentedSession segment(String driverId, List<Sample> samples, DetectionConfig config) {
    if (samples == null || samples.isEmpty()) {
      throw new EmptySessionException(driverId, "no samples supplied for driver " + driverId);
    }

    int skipped = 0;
    Map<Integer, List<Sample>> byLap = new TreeMap<>();
    for (Sample sample : samples) {
      if (sample == null || !sample.isWellFormed()) {
        skipped++;
        continue;
      }
      byLap.computeIfAbsent(sample.lapNumber(), lap -> new ArrayList<>()).add(sample);
    }
    if (byLap.isEmpty()) {
      throw new EmptySessionException(
          driverId, "all " + samples.size() + " samples for driver " + driverId + " are malformed");
    }

    List<Lap> laps = new ArrayList<>(byLap.size());
    for (Map.Entry<Integer, List<Sample>> entry : byLap.entrySet()) {
      List<Sample> lapSamples = entry.getValue();
      // List.sort is stable, equal timestamps keep recording order.
      lapSamples.sort(Comparator.comparingDouble(Sample::timestamp));
      laps.add(Lap.of(driverId, entry.getKey(), lapSamples));
    }

    int best = bestLapIndex(laps, config.minBestLapSamples());
    laps.set(best, laps.get(best).markBest());
    return new SegmentedSession(driverId, laps, skipped);
  }

  private static int bestLapIndex(List<Lap> laps, int minSamples) {
    int best = fastest(laps, minSamples);
    // Every lap is a fragment: fall back to the fastest of them.
    return best >= 0 ? best : fastest(laps, 0);
  }

  private static int fastest(List<Lap> laps, int minSamples) {
    int best = -1;
    for (int i = 0; i < laps.size(); i++) {
      Lap lap = laps.get(i);
      if (lap.size() < minSamples) {
        continue;
      }
      if (best < 0 || lap.lapTimeS() < laps.get(best).lapTimeS()) {
        best = i;
      }
    }
    return best;
  }
}
