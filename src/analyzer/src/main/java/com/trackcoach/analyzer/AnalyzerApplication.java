package com.trackcoach.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the analyzer service.
 *
 * <p>The analyzer turns lap-tagged telemetry into corner zones, per-corner metrics and driver
 * comparisons, and exposes operational metrics and health endpoints.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AnalyzerApplication {
  /**
   * Starts the analyzer application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(AnalyzerApplication.class, args);
  }
}
