package com.skyqa.locus.dto;

import com.skyqa.locus.exception.InvalidRegionException;
import lombok.Builder;

/**
 * Optional box and bounding lines restricting which points take part in a locus fit.
 *
 * <p>Membership is strict on every side: a point must lie inside the open x- and y-ranges, below
 * the upper line and above the lower line. Absent bounds do not restrict. Bounds are validated when
 * the region is built.
 */
@Builder(toBuilder = true)
public record FitRegion(Range xRange, Range yRange, FitLine upperLine, FitLine lowerLine) {

  /** Fraction of a range's span added on each side when the region is relaxed. */
  public static final double PADDING_FRACTION = 0.07;

  private static final FitRegion UNBOUNDED = new FitRegion(null, null, null, null);

  public static FitRegion unbounded() {
    return UNBOUNDED;
  }

  public boolean contains(double x, double y) {
    if (!Double.isFinite(x) || !Double.isFinite(y)) {
      return false;
    }
    if (xRange != null && !xRange.containsExclusive(x)) {
      return false;
    }
    if (yRange != null && !yRange.containsExclusive(y)) {
      return false;
    }
    return withinLines(x, y);
  }

  /** Only the bounding-line part of the membership test. */
  public boolean withinLines(double x, double y) {
    if (upperLine != null && !(y < upperLine.valueAt(x))) {
      return false;
    }
    return lowerLine == null || y > lowerLine.valueAt(x);
  }

  /** Copy with both ranges widened by {@link #PADDING_FRACTION} of their span; lines unchanged. */
  public FitRegion padded() {
    return new FitRegion(
        xRange == null ? null : xRange.padded(PADDING_FRACTION),
        yRange == null ? null : yRange.padded(PADDING_FRACTION),
        upperLine,
        lowerLine);
  }

  public boolean hasBoundingLines() {
    return upperLine != null || lowerLine != null;
  }

  /** Open interval {@code (min, max)}. */
  public record Range(double min, double max) {

    public Range {
      if (!Double.isFinite(min) || !Double.isFinite(max) || !(min < max)) {
        throw new InvalidRegionException(
            "Range must be two finite values with min < max, got [" + min + ", " + max + "]");
      }
    }

    public static Range of(double min, double max) {
      return new Range(min, max);
    }

    /** Builds a range from a two-element array, the form used in configuration. */
    public static Range of(double[] bounds) {
      if (bounds == null || bounds.length != 2) {
        throw new InvalidRegionException("Range must have exactly two values");
      }
      return new Range(bounds[0], bounds[1]);
    }

    public double span() {
      return max - min;
    }

    public boolean containsExclusive(double value) {
      return value > min && value < max;
    }

    public boolean containsInclusive(double value) {
      return value >= min && value <= max;
    }

    public Range padded(double fraction) {
      double pad = fraction * span();
      return new Range(min - pad, max + pad);
    }
  }
}
