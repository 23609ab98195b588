package com.skyqa.locus.dto;

import com.skyqa.locus.exception.InvalidRegionException;

/** Straight line {@code y = intercept + slope·x} bounding the points that take part in a fit. */
public record FitLine(double intercept, double slope) {

  public FitLine {
    if (!Double.isFinite(intercept) || !Double.isFinite(slope)) {
      throw new InvalidRegionException(
          "Fit line needs a finite intercept and slope, got intercept="
              + intercept
              + ", slope="
              + slope);
    }
  }

  public static FitLine of(double intercept, double slope) {
    return new FitLine(intercept, slope);
  }

  /** Builds a line from an {@code [intercept, slope]} pair as it appears in configuration. */
  public static FitLine fromPair(double[] interceptAndSlope) {
    if (interceptAndSlope == null || interceptAndSlope.length != 2) {
      throw new InvalidRegionException("Fit line must be given as [intercept, slope]");
    }
    return new FitLine(interceptAndSlope[0], interceptAndSlope[1]);
  }

  public double valueAt(double x) {
    return intercept + slope * x;
  }
}
