package com.trackcoach.analyzer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.trackcoach.analyzer.config.DetectionConfig;
import com.trackcoach.analyzer.service.LapAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(properties = {
    "analyzer.detection.merge-gap-m=35.0",
    "analyzer.extraction.braking-lookback-samples=80"
})
class AnalyzerApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Autowired
  private LapAnalysisService lapAnalysisService;

  @Test
  void contextLoads() {
    assertNotNull(applicationContext);
  }

  @Test
  void bindsDefaultDetectionConfigFromProperties() {
    DetectionConfig config = lapAnalysisService.defaultConfig();

    assertThat(config.mergeGapM()).isEqualTo(35.0);
    assertThat(config.brakingLookbackSamples()).isEqualTo(80);
    assertThat(config.steeringThresholdDeg()).isEqualTo(30.0);
    assertThat(config.insightSpeedThresholdKmh()).isEqualTo(2.0);
  }
}
