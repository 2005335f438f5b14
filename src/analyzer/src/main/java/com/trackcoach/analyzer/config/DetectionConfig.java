package com.trackcoach.analyzer.config;

/**
 * Immutable thresholds for one analysis call.
 *
 * <p>Passed explicitly into segmentation, detection, extraction and comparison so per-track
 * overrides never leak between calls. {@link #defaults()} mirrors {@code application.yml}.
 *
 * @param steeringThresholdDeg minimum |steering| to consider cornering
 * @param lateralGThreshold minimum |lateral g| to confirm cornering
 * @param minCornerDurationS shortest zone kept, in seconds
 * @param mergeGapM zones closer than this distance are merged
 * @param minLapSamples laps with fewer samples yield no corners
 * @param minBestLapSamples laps with fewer samples cannot be the best lap
 * @param brakingLookbackSamples samples searched before a zone for the braking point
 * @param brakePressureThresholdBar brake pressure that marks the braking point
 * @param throttleThresholdPct throttle position that marks throttle application
 * @param throttleOverrunSamples samples searched past the zone end for throttle application
 * @param insightSpeedThresholdKmh smallest speed delta reported as an insight
 * @param insightDistanceThresholdM smallest distance delta reported as an insight
 * @param insightTimeThresholdS smallest corner time delta reported in the summary
 */
public record DetectionConfig(
    double steeringThresholdDeg,
    double lateralGThreshold,
    double minCornerDurationS,
    double mergeGapM,
    int minLapSamples,
    int minBestLapSamples,
    int brakingLookbackSamples,
    double brakePressureThresholdBar,
    double throttleThresholdPct,
    int throttleOverrunSamples,
    double insightSpeedThresholdKmh,
    double insightDistanceThresholdM,
    double insightTimeThresholdS) {

  public DetectionConfig {
    requireNonNegative("steeringThresholdDeg", steeringThresholdDeg);
    requireNonNegative("lateralGThreshold", lateralGThreshold);
    requireNonNegative("minCornerDurationS", minCornerDurationS);
    requireNonNegative("mergeGapM", mergeGapM);
    requireNonNegative("minLapSamples", minLapSamples);
    requireNonNegative("minBestLapSamples", minBestLapSamples);
    if (brakingLookbackSamples <= 0) {
      throw new IllegalArgumentException("brakingLookbackSamples must be > 0");
    }
    requireNonNegative("brakePressureThresholdBar", brakePressureThresholdBar);
    requireNonNegative("throttleThresholdPct", throttleThresholdPct);
    requireNonNegative("throttleOverrunSamples", throttleOverrunSamples);
    requireNonNegative("insightSpeedThresholdKmh", insightSpeedThresholdKmh);
    requireNonNegative("insightDistanceThresholdM", insightDistanceThresholdM);
    requireNonNegative("insightTimeThresholdS", insightTimeThresholdS);
  }

  public static DetectionConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a builder pre-filled with this configuration, for per-call overrides.
   *
   * @return builder holding the current values
   */
  public Builder toBuilder() {
    return new Builder()
        .steeringThresholdDeg(steeringThresholdDeg)
        .lateralGThreshold(lateralGThreshold)
        .minCornerDurationS(minCornerDurationS)
        .mergeGapM(mergeGapM)
        .minLapSamples(minLapSamples)
        .minBestLapSamples(minBestLapSamples)
        .brakingLookbackSamples(brakingLookbackSamples)
        .brakePressureThresholdBar(brakePressureThresholdBar)
        .throttleThresholdPct(throttleThresholdPct)
        .throttleOverrunSamples(throttleOverrunSamples)
        .insightSpeedThresholdKmh(insightSpeedThresholdKmh)
        .insightDistanceThresholdM(insightDistanceThresholdM)
        .insightTimeThresholdS(insightTimeThresholdS);
  }

  private static void requireNonNegative(String name, double value) {
    if (Double.isNaN(value) || value < 0) {
      throw new IllegalArgumentException(name + " must be >= 0");
    }
  }

  /** Fluent builder starting from the documented defaults. */
  public static final class Builder {
    private double steeringThresholdDeg = 30.0;
    private double lateralGThreshold = 0.8;
    private double minCornerDurationS = 0.5;
    private double mergeGapM = 50.0;
    private int minLapSamples = 10;
    private int minBestLapSamples = 2;
    private int brakingLookbackSamples = 100;
    private double brakePressureThresholdBar = 20.0;
    private double throttleThresholdPct = 50.0;
    private int throttleOverrunSamples = 0;
    private double insightSpeedThresholdKmh = 2.0;
    private double insightDistanceThresholdM = 5.0;
    private double insightTimeThresholdS = 0.05;

    private Builder() {}

    public Builder steeringThresholdDeg(double value) {
      this.steeringThresholdDeg = value;
      return this;
    }

    public Builder lateralGThreshold(double value) {
      this.lateralGThreshold = value;
      return this;
    }

    public Builder minCornerDurationS(double value) {
      this.minCornerDurationS = value;
      return this;
    }

    public Builder mergeGapM(double value) {
      this.mergeGapM = value;
      return this;
    }

    public Builder minLapSamples(int value) {
      this.minLapSamples = value;
      return this;
    }

    public Builder minBestLapSamples(int value) {
      this.minBestLapSamples = value;
      return this;
    }

    public Builder brakingLookbackSamples(int value) {
      this.brakingLookbackSamples = value;
      return this;
    }

    public Builder brakePressureThresholdBar(double value) {
      this.brakePressureThresholdBar = value;
      return this;
    }

    public Builder throttleThresholdPct(double value) {
      this.throttleThresholdPct = value;
      return this;
    }

    public Builder throttleOverrunSamples(int value) {
      this.throttleOverrunSamples = value;
      return this;
    }

    public Builder insightSpeedThresholdKmh(double value) {
      this.insightSpeedThresholdKmh = value;
      return this;
    }

    public Builder insightDistanceThresholdM(double value) {
      this.insightDistanceThresholdM = value;
      return this;
    }

    public Builder insightTimeThresholdS(double value) {
      this.insightTimeThresholdS = value;
      return this;
    }

    public DetectionConfig build() {
      return new DetectionConfig(
          steeringThresholdDeg,
          lateralGThreshold,
          minCornerDurationS,
          mergeGapM,
          minLapSamples,
          minBestLapSamples,
          brakingLookbackSamples,
          brakePressureThresholdBar,
          throttleThresholdPct,
          throttleOverrunSamples,
          insightSpeedThresholdKmh,
          insightDistanceThresholdM,
          insightTimeThresholdS);
    }
  }
}
