package com.skyqa.locus.dto;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Clipped location and scale summary of a {@link ScalarSample}.
 *
 * <p>{@code total} counts the selected finite entries, {@code numUsed} those that survived the
 * clip. When {@code total} is zero every numeric field is NaN. {@code forcedMean} and
 * {@code sysErr} are null when not supplied.
 */
public record ClippedStatistics(
    int total,
    int numUsed,
    double mean,
    double median,
    double stdev,
    double clipThreshold,
    Double forcedMean,
    Double sysErr,
    boolean[] usedMask) {

  public ClippedStatistics {
    if (total < 0 || numUsed < 0 || numUsed > total) {
      throw new IllegalArgumentException(
          "Invalid counts: numUsed=" + numUsed + ", total=" + total);
    }
    if (total > 0 && clipThreshold < 0) {
      throw new IllegalArgumentException("Clip threshold must be non-negative: " + clipThreshold);
    }
    usedMask = usedMask == null ? new boolean[0] : usedMask.clone();
  }

  /** Result for a sample with nothing usable in it. */
  public static ClippedStatistics empty(int sampleSize, Double forcedMean) {
    return new ClippedStatistics(
        0,
        0,
        Double.NaN,
        Double.NaN,
        Double.NaN,
        Double.NaN,
        forcedMean,
        null,
        new boolean[sampleSize]);
  }

  @Override
  public boolean[] usedMask() {
    return usedMask.clone();
  }

  public boolean isEmpty() {
    return total == 0;
  }

  public ClippedStatistics withSysErr(double systematicError) {
    return new ClippedStatistics(
        total, numUsed, mean, median, stdev, clipThreshold, forcedMean, systematicError, usedMask);
  }

  /** Multiplies every location and scale field by {@code factor}; counts are untouched. */
  public ClippedStatistics scaled(double factor) {
    return new ClippedStatistics(
        total,
        numUsed,
        mean * factor,
        median * factor,
        stdev * factor,
        clipThreshold * Math.abs(factor),
        forcedMean == null ? null : forcedMean * factor,
        sysErr == null ? null : sysErr * Math.abs(factor),
        usedMask);
  }

  /**
   * Looks a statistic up by name, as used in enforcement thresholds.
   *
   * @throws IllegalArgumentException for an unknown name
   */
  public double statistic(String name) {
    return switch (name) {
      case "mean" -> mean;
      case "median" -> median;
      case "stdev" -> stdev;
      case "clip", "clipThreshold" -> clipThreshold;
      case "num", "numUsed" -> numUsed;
      case "total" -> total;
      case "forcedMean" -> forcedMean == null ? Double.NaN : forcedMean;
      case "sysErr" -> sysErr == null ? Double.NaN : sysErr;
      default -> throw new IllegalArgumentException("Unknown statistic: " + name);
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ClippedStatistics other)) {
      return false;
    }
    return total == other.total
        && numUsed == other.numUsed
        && Double.compare(mean, other.mean) == 0
        && Double.compare(median, other.median) == 0
        && Double.compare(stdev, other.stdev) == 0
        && Double.compare(clipThreshold, other.clipThreshold) == 0
        && Objects.equals(forcedMean, other.forcedMean)
        && Objects.equals(sysErr, other.sysErr)
        && Arrays.equals(usedMask, other.usedMask);
  }

  @Override
  public int hashCode() {
    int result =
        Objects.hash(
            total, numUsed, mean, median, stdev, clipThreshold, forcedMean, sysErr);
    return 31 * result + Arrays.hashCode(usedMask);
  }

  @Override
  public String toString() {
    return String.format(
        Locale.ROOT,
        "mean=%.5f median=%.5f stdev=%.5f clip=%.5f N=%d/%d%s",
        mean,
        median,
        stdev,
        clipThreshold,
        numUsed,
        total,
        sysErr == null ? "" : String.format(Locale.ROOT, " sysErr=%.5f", sysErr));
  }
}
