package com.trackcoach.analyzer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the analyzer service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code analyzer.*} prefix. They only seed the default {@link DetectionConfig}; callers may pass
 * their own configuration on every analysis call.
 */
@ConfigurationProperties(prefix = "analyzer")
public class AnalyzerProperties {
  private final Detection detection = new Detection();
  private final Extraction extraction = new Extraction();
  private final Insights insights = new Insights();
  private int workerThreads = 4;

  public Detection getDetection() {
    return detection;
  }

  public Extraction getExtraction() {
    return extraction;
  }

  public Insights getInsights() {
    return insights;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }

  /**
   * Builds the default per-call configuration from the bound values.
   *
   * @return validated detection configuration
   */
  public DetectionConfig toDetectionConfig() {
    return DetectionConfig.builder()
        .steeringThresholdDeg(detection.getSteeringThresholdDeg())
        .lateralGThreshold(detection.getLateralGThreshold())
        .minCornerDurationS(detection.getMinCornerDurationS())
        .mergeGapM(detection.getMergeGapM())
        .minLapSamples(detection.getMinLapSamples())
        .minBestLapSamples(detection.getMinBestLapSamples())
        .brakingLookbackSamples(extraction.getBrakingLookbackSamples())
        .brakePressureThresholdBar(extraction.getBrakePressureThresholdBar())
        .throttleThresholdPct(extraction.getThrottleThresholdPct())
        .throttleOverrunSamples(extraction.getThrottleOverrunSamples())
        .insightSpeedThresholdKmh(insights.getSpeedThresholdKmh())
        .insightDistanceThresholdM(insights.getDistanceThresholdM())
        .insightTimeThresholdS(insights.getTimeThresholdS())
        .build();
  }

  /** Corner detection thresholds. */
  public static class Detection {
    private double steeringThresholdDeg = 30.0;
    private double lateralGThreshold = 0.8;
    private double minCornerDurationS = 0.5;
    private double mergeGapM = 50.0;
    private int minLapSamples = 10;
    private int minBestLapSamples = 2;

    public double getSteeringThresholdDeg() {
      return steeringThresholdDeg;
    }

    public void setSteeringThresholdDeg(double steeringThresholdDeg) {
      this.steeringThresholdDeg = steeringThresholdDeg;
    }

    public double getLateralGThreshold() {
      return lateralGThreshold;
    }

    public void setLateralGThreshold(double lateralGThreshold) {
      this.lateralGThreshold = lateralGThreshold;
    }

    public double getMinCornerDurationS() {
      return minCornerDurationS;
    }

    public void setMinCornerDurationS(double minCornerDurationS) {
      this.minCornerDurationS = minCornerDurationS;
    }

    public double getMergeGapM() {
      return mergeGapM;
    }

    public void setMergeGapM(double mergeGapM) {
      this.mergeGapM = mergeGapM;
    }

    public int getMinLapSamples() {
      return minLapSamples;
    }

    public void setMinLapSamples(int minLapSamples) {
      this.minLapSamples = minLapSamples;
    }

    public int getMinBestLapSamples() {
      return minBestLapSamples;
    }

    public void setMinBestLapSamples(int minBestLapSamples) {
      this.minBestLapSamples = minBestLapSamples;
    }
  }

  /** Braking and throttle search windows used by corner metric extraction. */
  public static class Extraction {
    private int brakingLookbackSamples = 100;
    private double brakePressureThresholdBar = 20.0;
    private double throttleThresholdPct = 50.0;
    private int throttleOverrunSamples = 0;

    public int getBrakingLookbackSamples() {
      return brakingLookbackSamples;
    }

    public void setBrakingLookbackSamples(int brakingLookbackSamples) {
      this.brakingLookbackSamples = brakingLookbackSamples;
    }

    public double getBrakePressureThresholdBar() {
      return brakePressureThresholdBar;
    }

    public void setBrakePressureThresholdBar(double brakePressureThresholdBar) {
      this.brakePressureThresholdBar = brakePressureThresholdBar;
    }

    public double getThrottleThresholdPct() {
      return throttleThresholdPct;
    }

    public void setThrottleThresholdPct(double throttleThresholdPct) {
      this.throttleThresholdPct = throttleThresholdPct;
    }

    public int getThrottleOverrunSamples() {
      return throttleOverrunSamples;
    }

    public void setThrottleOverrunSamples(int throttleOverrunSamples) {
      this.throttleOverrunSamples = throttleOverrunSamples;
    }
  }

  /** Minimum deltas that produce a coaching insight. */
  public static class Insights {
    private double speedThresholdKmh = 2.0;
    private double distanceThresholdM = 5.0;
    private double timeThresholdS = 0.05;

    public double getSpeedThresholdKmh() {
      return speedThresholdKmh;
    }

    public void setSpeedThresholdKmh(double speedThresholdKmh) {
      this.speedThresholdKmh = speedThresholdKmh;
    }

    public double getDistanceThresholdM() {
      return distanceThresholdM;
    }

    public void setDistanceThresholdM(double distanceThresholdM) {
      this.distanceThresholdM = distanceThresholdM;
    }

    public double getTimeThresholdS() {
      return timeThresholdS;
    }

    public void setTimeThresholdS(double timeThresholdS) {
      this.timeThresholdS = timeThresholdS;
    }
  }
}
