package com.skyqa.locus.algorithm.distance;

import com.skyqa.locus.dto.FitLine;
import com.skyqa.locus.dto.FitRegion;
import com.skyqa.locus.dto.PolynomialModel;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Signed perpendicular distance from points to a fitted locus polynomial.
 *
 * <p>The distance is positive for points on or above the curve ({@code y ≥ P(x)}) and negative
 * below it. Points with a non-finite coordinate, outside the closed x bounds, above the upper
 * bounding line or below the lower one come back as NaN; the output always has one entry per
 * input point.
 *
 * <p>Points are independent of one another and are evaluated on a parallel stream; the polynomial
 * is immutable and each worker writes only its own slot of the result.
 */
@Component
public class CurveDistanceEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(CurveDistanceEvaluator.class);

  private final FootPointLocator footPointLocator;

  public CurveDistanceEvaluator() {
    this(new FootPointLocator());
  }

  CurveDistanceEvaluator(FootPointLocator footPointLocator) {
    this.footPointLocator = footPointLocator;
  }

  /** Unbounded distances in the units of the coordinates. */
  public double[] evaluateCurveDistance(double[] x, double[] y, PolynomialModel polynomial) {
    return evaluateCurveDistance(x, y, polynomial, null, null, null, 1.0);
  }

  /**
   * Distances bounded by the x range and lines of a fit region; its y range is not applied. A null
   * region bounds nothing.
   */
  public double[] evaluateCurveDistance(
      double[] x, double[] y, PolynomialModel polynomial, FitRegion region, double unitScale) {
    if (region == null) {
      region = FitRegion.unbounded();
    }
    return evaluateCurveDistance(
        x, y, polynomial, region.xRange(), region.upperLine(), region.lowerLine(), unitScale);
  }

  /**
   * @param xBounds closed x interval points must fall in, or null
   * @param upperLine points above this line are dropped, or null
   * @param lowerLine points below this line are dropped, or null
   * @param unitScale multiplier applied to every distance, e.g. 1000 for milli-magnitudes
   */
  public double[] evaluateCurveDistance(
      double[] x,
      double[] y,
      PolynomialModel polynomial,
      FitRegion.Range xBounds,
      FitLine upperLine,
      FitLine lowerLine,
      double unitScale) {
    if (x.length != y.length) {
      throw new IllegalArgumentException(
          "x and y must have equal lengths: " + x.length + " vs " + y.length);
    }
    PolynomialModel slope = polynomial.derivative();
    double[] distances = new double[x.length];
    IntStream.range(0, x.length)
        .parallel()
        .forEach(
            i -> {
              if (!inside(x[i], y[i], xBounds, upperLine, lowerLine)) {
                distances[i] = Double.NaN;
                return;
              }
              distances[i] = unitScale * signedDistance(polynomial, slope, x[i], y[i]);
            });
    logger.debug("Evaluated distances of {} points to {}", x.length, polynomial);
    return distances;
  }

  /** Distance of a single point; NaN if no nearest curve point could be found. */
  public double signedDistance(PolynomialModel polynomial, double x, double y) {
    return signedDistance(polynomial, polynomial.derivative(), x, y);
  }

  private double signedDistance(
      PolynomialModel polynomial, PolynomialModel slope, double x, double y) {
    double t = footPointLocator.locateFoot(polynomial, slope, x, y);
    if (Double.isNaN(t)) {
      return Double.NaN;
    }
    double distance = Math.sqrt(FootPointLocator.squaredDistance(polynomial, t, x, y));
    return y >= polynomial.evaluate(x) ? distance : -distance;
  }

  private static boolean inside(
      double x, double y, FitRegion.Range xBounds, FitLine upperLine, FitLine lowerLine) {
    if (!Double.isFinite(x) || !Double.isFinite(y)) {
      return false;
    }
    if (xBounds != null && !xBounds.containsInclusive(x)) {
      return false;
    }
    if (upperLine != null && y > upperLine.valueAt(x)) {
      return false;
    }
    return lowerLine == null || y >= lowerLine.valueAt(x);
  }
}
