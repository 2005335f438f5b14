package com.trackcoach.analyzer.compare;

/**
 * One coaching sentence with the metric it describes.
 *
 * @param metric metric whose delta crossed its threshold
 * @param impactS estimated corner-time effect in seconds, positive when driver B gains
 * @param text sentence in plain units
 */
public record Insight(ComparedMetric metric, double impactS, String text) {}
