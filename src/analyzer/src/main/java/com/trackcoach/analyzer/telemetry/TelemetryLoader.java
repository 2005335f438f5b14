package com.trackcoach.analyzer.telemetry;

import java.util.List;

/**
 * Source of lap-tagged telemetry for one driver in one race.
 *
 * <p>Implementations own file formats, storage and schema normalization; the analyzer only sees
 * typed {@link Sample}s.
 */
public interface TelemetryLoader {
  /**
   * Returns every sample recorded for the session, each carrying its lap number.
   *
   * @param session track, race and driver to load
   * @return samples in recording order; empty when the session has no data
   */
  List<Sample> loadSamples(SessionRef session);
}
