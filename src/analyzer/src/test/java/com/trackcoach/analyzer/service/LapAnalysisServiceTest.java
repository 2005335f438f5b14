package com.trackcoach.analyzer.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import com.trackcoach.analyzer.SyntheticLaps;
import com.trackcoach.analyzer.compare.DriverComparator;
import com.trackcoach.analyzer.compare.DriverComparison;
import com.trackcoach.analyzer.config.AnalyzerProperties;
import com.trackcoach.analyzer.corner.CornerDetector;
import com.trackcoach.analyzer.corner.CornerMetricsExtractor;
import com.trackcoach.analyzer.telemetry.EmptySessionException;
import com.trackcoach.analyzer.telemetry.LapSegmenter;
import com.trackcoach.analyzer.telemetry.Sample;
import com.trackcoach.analyzer.telemetry.SessionRef;
import com.trackcoach.analyzer.telemetry.TelemetryLoader;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class LapAnalysisServiceTest {
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final TelemetryLoader loader = mock(TelemetryLoader.class);
  private LapAnalysisService service;

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.stop();
    }
  }

  @Test
  void analyzesEveryLapAndFlagsBest() {
    service = newService(new CornerDetector(), Optional.of(loader));

    DriverAnalysis analysis = service.analyzeSession("7", threeLaps());

    assertThat(analysis.driverId()).isEqualTo("7");
    assertThat(analysis.laps()).extracting(LapAnalysis::lapNumber).containsExactly(1, 2, 3);
    assertThat(analysis.bestLapNumber()).isEqualTo(2);
    assertThat(analysis.bestLap()).map(LapAnalysis::bestLap).contains(true);
    assertThat(analysis.laps()).allSatisfy(lap -> {
      assertThat(lap.isFailed()).isFalse();
      assertThat(lap.zones()).hasSize(1);
      assertThat(lap.corners()).hasSize(1);
      assertThat(lap.sampleCount()).isEqualTo(401);
    });
    assertThat(analysis.failedLaps()).isEmpty();
    assertThat(analysis.missingChannels()).isEmpty();
    assertThat(meterRegistry.get("analyzer.laps.analyzed").counter().count()).isEqualTo(3.0);
    assertThat(meterRegistry.get("analyzer.corners.detected").counter().count()).isEqualTo(3.0);
  }

  @Test
  void failingLapDoesNotAbortSession() {
    CornerDetector detector = spy(new CornerDetector());
    doThrow(new IllegalStateException("steering sensor glitch"))
        .when(detector).detect(argThat(lap -> lap != null && lap.lapNumber() == 3), any());
    service = newService(detector, Optional.of(loader));

    DriverAnalysis analysis = service.analyzeSession("7", threeLaps());

    assertThat(analysis.failedLaps()).containsExactly(3);
    assertThat(analysis.laps().get(2).error()).isEqualTo("steering sensor glitch");
    assertThat(analysis.laps().get(2).corners()).isEmpty();
    assertThat(analysis.laps().get(0).corners()).hasSize(1);
    assertThat(analysis.laps().get(1).corners()).hasSize(1);
    assertThat(meterRegistry.get("analyzer.laps.failed").counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("analyzer.laps.analyzed").counter().count()).isEqualTo(2.0);
  }

  @Test
  void reportsMissingChannelsAndSkippedSamples() {
    service = newService(new CornerDetector(), Optional.of(loader));
    List<Sample> samples = new ArrayList<>(SyntheticLaps.map(
        SyntheticLaps.singleCorner(1, 0.0, 0.0, 60), s -> SyntheticLaps.withBrake(s, null)));
    samples.add(new Sample(Double.NaN, 10.0, 100.0, 0.0, 0.0, 0.0, null, 100.0, 1));

    DriverAnalysis analysis = service.analyzeSession("7", samples);

    assertThat(analysis.missingChannels()).containsExactly("brake_front_bar");
    assertThat(analysis.skippedSamples()).isEqualTo(1);
    assertThat(analysis.bestLap().orElseThrow().corners().get(0).brakingPointDistanceM()).isNull();
    assertThat(meterRegistry.get("analyzer.channel.missing").tag("channel", "brake_front_bar").counter().count())
        .isEqualTo(1.0);
    assertThat(meterRegistry.get("analyzer.samples.skipped").counter().count()).isEqualTo(1.0);
  }

  @Test
  void emptySessionPropagates() {
    service = newService(new CornerDetector(), Optional.of(loader));

    assertThatThrownBy(() -> service.analyzeSession("7", List.of()))
        .isInstanceOf(EmptySessionException.class);
  }

  @Test
  void analyzeRaceSkipsDriversThatFail() {
    when(loader.loadSamples(new SessionRef("barber", 1, "A"))).thenReturn(SyntheticLaps.singleCorner(1, 0.0, 0.0, 60));
    when(loader.loadSamples(new SessionRef("barber", 1, "B"))).thenReturn(SyntheticLaps.singleCorner(1, 0.0, 3.0, 80));
    when(loader.loadSamples(new SessionRef("barber", 1, "C"))).thenReturn(List.of());
    when(loader.loadSamples(new SessionRef("barber", 1, "D"))).thenThrow(new IllegalStateException("file unreadable"));
    service = newService(new CornerDetector(), Optional.of(loader));

    RaceAnalysis race = service.analyzeRace("barber", 1, List.of("A", "B", "C", "D"));

    assertThat(race.trackId()).isEqualTo("barber");
    assertThat(race.raceNumber()).isEqualTo(1);
    assertThat(race.drivers()).containsOnlyKeys("A", "B");
    assertThat(race.drivers().keySet()).containsExactly("A", "B");
    assertThat(race.skippedDrivers()).containsOnlyKeys("C", "D");
    assertThat(race.skippedDrivers().get("C")).contains("no samples");
    assertThat(race.skippedDrivers().get("D")).isEqualTo("file unreadable");
    assertThat(meterRegistry.get("analyzer.drivers.failed").counter().count()).isEqualTo(2.0);
  }

  @Test
  void comparesDriversOnTheirBestLaps() {
    List<Sample> driverB = new ArrayList<>(SyntheticLaps.singleCorner(1, 0.0, -10.0, 60));
    driverB.addAll(SyntheticLaps.singleCorner(2, 100.0, 3.0, 80));
    when(loader.loadSamples(new SessionRef("barber", 2, "A"))).thenReturn(SyntheticLaps.singleCorner(1, 0.0, 0.0, 60));
    when(loader.loadSamples(new SessionRef("barber", 2, "B"))).thenReturn(driverB);
    service = newService(new CornerDetector(), Optional.of(loader));

    DriverComparison comparison = service.compareDrivers(
        new SessionRef("barber", 2, "A"), new SessionRef("barber", 2, "B"));

    assertThat(comparison.driverAId()).isEqualTo("A");
    assertThat(comparison.driverBId()).isEqualTo("B");
    assertThat(comparison.corners()).hasSize(1);
    assertThat(comparison.corners().get(0).brakingPointDeltaM()).isEqualTo(20.0);
    assertThat(comparison.corners().get(0).insights().get(0)).startsWith("Driver B brakes 20.0m later");
    assertThat(comparison.expectedLapTimeGainS()).isNegative();
  }

  @Test
  void failedBestLapContributesNoCorners() {
    CornerDetector detector = spy(new CornerDetector());
    doThrow(new IllegalStateException("boom"))
        .when(detector).detect(argThat(lap -> lap != null && "B".equals(lap.driverId())), any());
    service = newService(detector, Optional.of(loader));
    DriverAnalysis a = service.analyzeSession("A", SyntheticLaps.singleCorner(1, 0.0, 0.0, 60));
    DriverAnalysis b = service.analyzeSession("B", SyntheticLaps.singleCorner(1, 0.0, 0.0, 60));

    DriverComparison comparison = service.compareBestLaps(a, b, service.defaultConfig());

    assertThat(comparison.corners()).isEmpty();
    assertThat(comparison.unmatchedCorners()).isEqualTo(1);
  }

  @Test
  void loaderIsRequiredOnlyForLoadingOperations() {
    service = newService(new CornerDetector(), Optional.empty());

    assertThat(service.analyzeSession("7", threeLaps()).laps()).hasSize(3);
    assertThatThrownBy(() -> service.analyzeDriver(new SessionRef("barber", 1, "7")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("TelemetryLoader");
    assertThatThrownBy(() -> service.analyzeRace("barber", 1, List.of("7")))
        .isInstanceOf(IllegalStateException.class);
  }

  private LapAnalysisService newService(CornerDetector detector, Optional<TelemetryLoader> telemetryLoader) {
    AnalyzerProperties properties = new AnalyzerProperties();
    properties.setWorkerThreads(2);
    return new LapAnalysisService(
        new LapSegmenter(),
        detector,
        new CornerMetricsExtractor(),
        new DriverComparator(),
        properties,
        meterRegistry,
        telemetryLoader);
  }

  private static List<Sample> threeLaps() {
    List<Sample> samples = new ArrayList<>();
    samples.addAll(SyntheticLaps.singleCorner(1, 0.0, 0.0, 60));
    samples.addAll(SyntheticLaps.singleCorner(2, 100.0, 5.0, 60));
    samples.addAll(SyntheticLaps.singleCorner(3, 200.0, -5.0, 60));
    return samples;
  }
}
