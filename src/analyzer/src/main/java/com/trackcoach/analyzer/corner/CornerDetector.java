package com.trackcoach.analyzer.corner;

import com.trackcoach.analyzer.config.DetectionConfig;
import com.trackcoach.analyzer.telemetry.EmptyInputException;
import com.trackcoach.analyzer.telemetry.Lap;
import com.trackcoach.analyzer.telemetry.Sample;
import com.trackcoach.analyzer.telemetry.Signals;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Finds corner zones in one lap from steering angle and lateral acceleration.
 *
 * <p>Pipeline:
 * <ul>
 *   <li>mask samples where both |steering| and |lateral g| exceed their thresholds</li>
 *   <li>group consecutive masked samples into candidate runs</li>
 *   <li>drop runs shorter than the minimum duration or with fewer than two samples</li>
 *   <li>merge runs separated by less than the merge gap (chicanes collapse into one zone)</li>
 *   <li>place the apex at the slowest sample and number zones in lap order</li>
 * </ul>
 *
 * <p>Stateless: one instance can serve any number of laps concurrently.
 */
@Component
public class CornerDetector {

  /**
   * Detects the corner zones of a lap.
   *
   * @param lap lap whose samples are ordered by timestamp
   * @param config detection thresholds
   * @return non-overlapping zones ordered by start index; empty when nothing qualifies
   * @throws EmptyInputException when the lap has no samples
   */
  public List<CornerZone> detect(Lap lap, DetectionConfig config) {
    if (lap.size() == 0) {
      throw new EmptyInputException(
          "lap " + lap.lapNumber() + " of driver " + lap.driverId() + " has no samples");
    }
    if (lap.size() < config.minLapSamples()) {
      return List.of();
    }

    List<Sample> samples = lap.samples();
    List<IndexRange> candidates = findRuns(cornerMask(lap, config));
    List<IndexRange> kept = filterByDuration(samples, candidates, config.minCornerDurationS());
    List<IndexRange> merged = mergeNearby(samples, kept, config.mergeGapM());

    List<CornerZone> zones = new ArrayList<>(merged.size());
    for (IndexRange range : merged) {
      zones.add(toZone(samples, range, zones.size() + 1));
    }
    return zones;
  }

  /**
   * Combined cornering mask: strict AND of the steering and lateral-g masks.
   *
   * <p>A missing reading never confirms cornering.
   *
   * @param lap lap to scan
   * @param config thresholds
   * @return one flag per sample
   */
  public boolean[] cornerMask(Lap lap, DetectionConfig config) {
    boolean[] mask = new boolean[lap.size()];
    for (int i = 0; i < mask.length; i++) {
      Sample sample = lap.sample(i);
      boolean highSteering = Signals.exceedsMagnitude(sample.steeringDeg(), config.steeringThresholdDeg());
      boolean highLateralG = Signals.exceedsMagnitude(sample.lateralG(), config.lateralGThreshold());
      mask[i] = highSteering && highLateralG;
    }
    return mask;
  }

  static List<IndexRange> findRuns(boolean[] mask) {
    List<IndexRange> runs = new ArrayList<>();
    int start = -1;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i] && start < 0) {
        start = i;
      } else if (!mask[i] && start >= 0) {
        runs.add(new IndexRange(start, i - 1));
        start = -1;
      }
    }
    if (start >= 0) {
      runs.add(new IndexRange(start, mask.length - 1));
    }
    return runs;
  }

  static List<IndexRange> filterByDuration(List<Sample> samples, List<IndexRange> runs, double minDurationS) {
    List<IndexRange> kept = new ArrayList<>(runs.size());
    for (IndexRange run : runs) {
      if (run.count() < 2) {
        continue;
      }
      double duration = samples.get(run.end()).timestamp() - samples.get(run.start()).timestamp();
      // Written as a negated >= so a NaN duration is discarded too.
      if (!(duration >= minDurationS)) {
        continue;
      }
      kept.add(run);
    }
    return kept;
  }

  static List<IndexRange> mergeNearby(List<Sample> samples, List<IndexRange> ranges, double mergeGapM) {
    List<IndexRange> merged = new ArrayList<>(ranges.size());
    for (IndexRange current : ranges) {
      if (merged.isEmpty()) {
        merged.add(current);
        continue;
      }
      IndexRange last = merged.get(merged.size() - 1);
      double gap = samples.get(current.start()).distanceM() - samples.get(last.end()).distanceM();
      if (gap < mergeGapM) {
        merged.set(merged.size() - 1, new IndexRange(last.start(), current.end()));
      } else {
        merged.add(current);
      }
    }
    return merged;
  }

  /**
   * Index of the lowest speed reading in the range, first one on ties.
   *
   * @return apex index, or the range start when no speed reading is present
   */
  static int apexIndex(List<Sample> samples, IndexRange range) {
    int apex = -1;
    double slowest = Double.POSITIVE_INFINITY;
    for (int i = range.start(); i <= range.end(); i++) {
      Double speed = samples.get(i).speedKmh();
      if (Signals.isPresent(speed) && (apex < 0 || speed < slowest)) {
        apex = i;
        slowest = speed;
      }
    }
    return apex < 0 ? range.start() : apex;
  }

  private static CornerZone toZone(List<Sample> samples, IndexRange range, int zoneIndex) {
    int apex = apexIndex(samples, range);
    Sample start = samples.get(range.start());
    Sample end = samples.get(range.end());
    return new CornerZone(
        zoneIndex,
        range.start(),
        apex,
        range.end(),
        end.timestamp() - start.timestamp(),
        start.distanceM(),
        samples.get(apex).distanceM(),
        end.distanceM());
  }
}
