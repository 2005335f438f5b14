package com.trackcoach.analyzer.telemetry;

import java.util.List;
import java.util.function.Function;

/**
 * Null- and NaN-aware helpers for reading sensor channels.
 *
 * <p>Every aggregate skips missing readings and returns {@code null} when nothing is left, so a
 * missing channel never turns into a number.
 */
public final class Signals {
  private Signals() {}

  public static boolean isPresent(Double value) {
    return value != null && !value.isNaN();
  }

  /**
   * Returns {@code |value| > threshold}, treating a missing reading as {@code false}.
   *
   * @param value channel reading, possibly missing
   * @param threshold strict lower bound on the magnitude
   * @return whether the reading confirms the condition
   */
  public static boolean exceedsMagnitude(Double value, double threshold) {
    return isPresent(value) && Math.abs(value) > threshold;
  }

  public static boolean exceeds(Double value, double threshold) {
    return isPresent(value) && value > threshold;
  }

  /** Value or {@code null} when the reading is missing. */
  public static Double orNull(Double value) {
    return isPresent(value) ? value : null;
  }

  /**
   * Maximum of a channel over {@code [from, to]} inclusive.
   *
   * @return maximum, or {@code null} if every reading is missing
   */
  public static Double max(List<Sample> samples, int from, int to, Function<Sample, Double> channel) {
    Double max = null;
    for (int i = from; i <= to; i++) {
      Double value = channel.apply(samples.get(i));
      if (isPresent(value) && (max == null || value > max)) {
        max = value;
      }
    }
    return max;
  }

  /** Maximum absolute value of a channel over {@code [from, to]} inclusive. */
  public static Double maxAbs(List<Sample> samples, int from, int to, Function<Sample, Double> channel) {
    return max(samples, from, to, sample -> {
      Double value = channel.apply(sample);
      return isPresent(value) ? Math.abs(value) : null;
    });
  }

  /**
   * Population standard deviation of a channel over {@code [from, to]} inclusive.
   *
   * @return standard deviation, or {@code null} if every reading is missing
   */
  public static Double populationStdDev(
      List<Sample> samples, int from, int to, Function<Sample, Double> channel) {
    int count = 0;
    double sum = 0.0;
    for (int i = from; i <= to; i++) {
      Double value = channel.apply(samples.get(i));
      if (isPresent(value)) {
        sum += value;
        count++;
      }
    }
    if (count == 0) {
      return null;
    }
    double mean = sum / count;
    double squares = 0.0;
    for (int i = from; i <= to; i++) {
      Double value = channel.apply(samples.get(i));
      if (isPresent(value)) {
        double diff = value - mean;
        squares += diff * diff;
      }
    }
    return Math.sqrt(squares / count);
  }

  /**
   * Returns whether any sample carries a reading on the channel.
   *
   * @param samples samples to inspect
   * @param channel channel accessor
   * @return {@code false} when the channel is absent from every sample
   */
  public static boolean hasChannel(List<Sample> samples, Function<Sample, Double> channel) {
    for (Sample sample : samples) {
      if (isPresent(channel.apply(sample))) {
        return true;
      }
    }
    return false;
  }
}
