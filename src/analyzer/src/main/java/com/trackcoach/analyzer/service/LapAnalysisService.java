package com.trackcoach.analyzer.service;

import com.trackcoach.analyzer.compare.DriverComparator;
import com.trackcoach.analyzer.compare.DriverComparison;
import com.trackcoach.analyzer.config.AnalyzerProperties;
import com.trackcoach.analyzer.config.DetectionConfig;
import com.trackcoach.analyzer.corner.CornerDetector;
import com.trackcoach.analyzer.corner.CornerMetrics;
import com.trackcoach.analyzer.corner.CornerMetricsExtractor;
import com.trackcoach.analyzer.corner.CornerZone;
import com.trackcoach.analyzer.telemetry.Lap;
import com.trackcoach.analyzer.telemetry.LapSegmenter;
import com.trackcoach.analyzer.telemetry.Sample;
import com.trackcoach.analyzer.telemetry.SegmentedSession;
import com.trackcoach.analyzer.telemetry.SessionRef;
import com.trackcoach.analyzer.telemetry.Signals;
import com.trackcoach.analyzer.telemetry.TelemetryLoader;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the corner analysis pipeline for laps, drivers and races.
 *
 * <p>This service:
 * <ul>
 *   <li>loads a driver's samples through the optional {@link TelemetryLoader}</li>
 *   <li>segments laps, then detects and measures corners lap by lap</li>
 *   <li>fans drivers of a race out over a bounded worker pool</li>
 *   <li>compares two drivers on their best laps</li>
 * </ul>
 *
 * <p>A failing lap is recorded on its {@link LapAnalysis} and a failing driver on the
 * {@link RaceAnalysis}; neither aborts the rest of the batch.
 */
@Service
public class LapAnalysisService {
  private static final Logger LOGGER = LoggerFactory.getLogger(LapAnalysisService.class);
  private static final Map<String, Function<Sample, Double>> CHANNELS = channels();

  private final LapSegmenter segmenter;
  private final CornerDetector detector;
  private final CornerMetricsExtractor extractor;
  private final DriverComparator comparator;
  private final Optional<TelemetryLoader> loader;
  private final DetectionConfig defaultConfig;
  private final ExecutorService executor;
  private final MeterRegistry meterRegistry;
  private final Counter skippedSamplesCounter;
  private final Counter lapsAnalyzedCounter;
  private final Counter lapsFailedCounter;
  private final Counter cornersCounter;
  private final Counter driversFailedCounter;
  private final ConcurrentHashMap<String, Counter> missingChannelCounters;

  public LapAnalysisService(
    LapSegmenter segmenter,
    CornerDetector detector,
    CornerMetricsExtractor extractor,
    DriverComparator comparator,
    AnalyzerProperties properties,
    MeterRegistry meterRegistry,
    Optional<TelemetryLoader> loader
  ) {
    this.segmenter = segmenter;
    this.detector = detector;
    this.extractor = extractor;
    this.comparator = comparator;
    this.loader = loader;
    this.defaultConfig = properties.toDetectionConfig();
    AtomicInteger threadIndex = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), runnable -> {
      Thread thread = new Thread(runnable, "analyzer-worker-" + threadIndex.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    this.meterRegistry = meterRegistry;
    this.skippedSamplesCounter = meterRegistry.counter("analyzer.samples.skipped");
    this.lapsAnalyzedCounter = meterRegistry.counter("analyzer.laps.analyzed");
    this.lapsFailedCounter = meterRegistry.counter("analyzer.laps.failed");
    this.cornersCounter = meterRegistry.counter("analyzer.corners.detected");
    this.driversFailedCounter = meterRegistry.counter("analyzer.drivers.failed");
    this.missingChannelCounters = new ConcurrentHashMap<>();
  }

  /** Stops the worker pool and waits briefly for running analyses. */
  @jakarta.annotation.PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  public DetectionConfig defaultConfig() {
    return defaultConfig;
  }

  public DriverAnalysis analyzeSession(String driverId, List<Sample> samples) {
    return analyzeSession(driverId, samples, defaultConfig);
  }

  /**
   * Analyzes every lap of one driver's session.
   *
   * @param driverId driver the samples belong to
   * @param samples lap-tagged session samples
   * @param config thresholds for this call
   * @return per-lap analyses; failed laps carry their error
   * @throws com.trackcoach.analyzer.telemetry.EmptySessionException when no usable sample exists
   */
  public DriverAnalysis analyzeSession(String driverId, List<Sample> samples, DetectionConfig config) {
    SegmentedSession session = segmenter.segment(driverId, samples, config);
    if (session.skippedSamples() > 0) {
      skippedSamplesCounter.increment(session.skippedSamples());
      LOGGER.debug("Driver {}: skipped {} malformed samples", driverId, session.skippedSamples());
    }
    List<String> missingChannels = detectMissingChannels(driverId, session);

    List<LapAnalysis> laps = new ArrayList<>(session.laps().size());
    List<Integer> failedLaps = new ArrayList<>();
    int bestLapNumber = -1;
    for (Lap lap : session.laps()) {
      LapAnalysis analysis = analyzeLap(lap, config);
      laps.add(analysis);
      if (analysis.isFailed()) {
        failedLaps.add(lap.lapNumber());
      }
      if (lap.bestLap()) {
        bestLapNumber = lap.lapNumber();
      }
    }

    LOGGER.info(
        "Driver {}: {} laps analyzed, best lap {}, {} failed, {} samples skipped",
        driverId,
        laps.size(),
        bestLapNumber,
        failedLaps.size(),
        session.skippedSamples());
    return new DriverAnalysis(
        driverId, laps, bestLapNumber, session.skippedSamples(), missingChannels, failedLaps);
  }

  /**
   * Detects and measures the corners of one lap.
   *
   * <p>Any runtime failure is caught and returned as a failed {@link LapAnalysis}.
   *
   * @param lap lap to analyze
   * @param config thresholds for this call
   * @return lap analysis, never {@code null}
   */
  public LapAnalysis analyzeLap(Lap lap, DetectionConfig config) {
    try {
      List<CornerZone> zones = detector.detect(lap, config);
      List<CornerMetrics> corners = extractor.extractAll(lap, zones, config);
      lapsAnalyzedCounter.increment();
      cornersCounter.increment(zones.size());
      LOGGER.debug("Driver {} lap {}: {} corners detected", lap.driverId(), lap.lapNumber(), zones.size());
      return new LapAnalysis(
          lap.lapNumber(), lap.lapTimeS(), lap.bestLap(), lap.size(), zones, corners, null);
    } catch (RuntimeException ex) {
      lapsFailedCounter.increment();
      LOGGER.warn("Driver {} lap {}: analysis failed", lap.driverId(), lap.lapNumber(), ex);
      return new LapAnalysis(
          lap.lapNumber(), lap.lapTimeS(), lap.bestLap(), lap.size(), List.of(), List.of(), describe(ex));
    }
  }

  public DriverAnalysis analyzeDriver(SessionRef session) {
    return analyzeDriver(session, defaultConfig);
  }

  /**
   * Loads and analyzes one driver's session.
   *
   * @param session track, race and driver
   * @param config thresholds for this call
   * @return driver analysis
   */
  public DriverAnalysis analyzeDriver(SessionRef session, DetectionConfig config) {
    List<Sample> samples = requireLoader().loadSamples(session);
    LOGGER.debug("Loaded {} samples for {}", samples == null ? 0 : samples.size(), session);
    return analyzeSession(session.driverId(), samples, config);
  }

  public RaceAnalysis analyzeRace(String trackId, int raceNumber, List<String> driverIds) {
    return analyzeRace(trackId, raceNumber, driverIds, defaultConfig);
  }

  /**
   * Analyzes several drivers of one race in parallel.
   *
   * @param trackId track identifier
   * @param raceNumber race number
   * @param driverIds drivers to analyze
   * @param config thresholds shared by every driver of this call
   * @return analyses of the drivers that succeeded plus the reasons for those that did not
   */
  public RaceAnalysis analyzeRace(String trackId, int raceNumber, List<String> driverIds, DetectionConfig config) {
    TelemetryLoader telemetryLoader = requireLoader();
    Map<String, Future<DriverAnalysis>> futures = new LinkedHashMap<>();
    for (String driverId : driverIds) {
      SessionRef session = new SessionRef(trackId, raceNumber, driverId);
      futures.put(driverId, executor.submit(
          () -> analyzeSession(driverId, telemetryLoader.loadSamples(session), config)));
    }

    Map<String, DriverAnalysis> drivers = new LinkedHashMap<>();
    Map<String, String> skipped = new LinkedHashMap<>();
    try {
      for (Map.Entry<String, Future<DriverAnalysis>> entry : futures.entrySet()) {
        try {
          drivers.put(entry.getKey(), entry.getValue().get());
        } catch (ExecutionException ex) {
          Throwable cause = ex.getCause() == null ? ex : ex.getCause();
          driversFailedCounter.increment();
          skipped.put(entry.getKey(), describe(cause));
          LOGGER.warn("Driver {} in {} race {} skipped", entry.getKey(), trackId, raceNumber, cause);
        }
      }
    } catch (InterruptedException ex) {
      futures.values().forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Race analysis interrupted for " + trackId + " race " + raceNumber, ex);
    }

    LOGGER.info(
        "Race {} r{}: {} drivers analyzed, {} skipped", trackId, raceNumber, drivers.size(), skipped.size());
    return new RaceAnalysis(trackId, raceNumber, drivers, skipped);
  }

  public DriverComparison compareDrivers(SessionRef driverA, SessionRef driverB) {
    return compareDrivers(driverA, driverB, defaultConfig);
  }

  /**
   * Loads both sessions and compares the drivers on their best laps.
   *
   * @param driverA reference driver session
   * @param driverB compared driver session
   * @param config thresholds for this call
   * @return corner-by-corner comparison with deltas {@code B - A}
   */
  public DriverComparison compareDrivers(SessionRef driverA, SessionRef driverB, DetectionConfig config) {
    return compareBestLaps(analyzeDriver(driverA, config), analyzeDriver(driverB, config), config);
  }

  /**
   * Compares two already analyzed drivers on their best laps.
   *
   * <p>A best lap whose analysis failed contributes no corners.
   *
   * @param driverA reference driver
   * @param driverB compared driver
   * @param config insight thresholds
   * @return corner-by-corner comparison
   */
  public DriverComparison compareBestLaps(DriverAnalysis driverA, DriverAnalysis driverB, DetectionConfig config) {
    return comparator.compare(
        driverA.driverId(), bestLapCorners(driverA), driverB.driverId(), bestLapCorners(driverB), config);
  }

  private static List<CornerMetrics> bestLapCorners(DriverAnalysis analysis) {
    return analysis.bestLap().map(LapAnalysis::corners).orElse(List.of());
  }

  private TelemetryLoader requireLoader() {
    return loader.orElseThrow(() -> new IllegalStateException("No TelemetryLoader bean is configured"));
  }

  private List<String> detectMissingChannels(String driverId, SegmentedSession session) {
    List<Sample> all = new ArrayList<>();
    session.laps().forEach(lap -> all.addAll(lap.samples()));
    List<String> missing = new ArrayList<>();
    for (Map.Entry<String, Function<Sample, Double>> channel : CHANNELS.entrySet()) {
      if (Signals.hasChannel(all, channel.getValue())) {
        continue;
      }
      missing.add(channel.getKey());
      missingChannelCounters.computeIfAbsent(
          channel.getKey(),
          name -> meterRegistry.counter("analyzer.channel.missing", "channel", name)
      ).increment();
    }
    if (!missing.isEmpty()) {
      LOGGER.info("Driver {}: channels {} absent, dependent metrics will be null", driverId, missing);
    }
    return missing;
  }

  private static String describe(Throwable ex) {
    String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }

  private static Map<String, Function<Sample, Double>> channels() {
    Map<String, Function<Sample, Double>> channels = new LinkedHashMap<>();
    channels.put("speed_kmh", Sample::speedKmh);
    channels.put("steering_deg", Sample::steeringDeg);
    channels.put("lateral_g", Sample::lateralG);
    channels.put("brake_front_bar", Sample::brakeFrontBar);
    channels.put("throttle_pct", Sample::throttlePct);
    return channels;
  }
}
