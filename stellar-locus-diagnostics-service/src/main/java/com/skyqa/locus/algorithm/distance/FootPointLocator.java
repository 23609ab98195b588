package com.skyqa.locus.algorithm.distance;

import com.skyqa.locus.algorithm.util.PolynomialRealRootFinder;
import com.skyqa.locus.dto.PolynomialModel;

/**
 * Locates the point of a curve {@code y = P(t)} nearest to a given point.
 *
 * <p>At the nearest point the vector from the point to the curve is perpendicular to the tangent,
 * {@code (t − x) + (P(t) − y)·P′(t) = 0}, a polynomial of degree {@code 2d − 1}. Every real root is
 * a candidate; the one with the smallest squared distance wins.
 */
public class FootPointLocator {

  private final PolynomialRealRootFinder rootFinder;

  public FootPointLocator() {
    this(new PolynomialRealRootFinder());
  }

  public FootPointLocator(PolynomialRealRootFinder rootFinder) {
    this.rootFinder = rootFinder;
  }

  /**
   * @param curve the curve
   * @param slope its derivative, passed in so callers evaluating many points build it once
   * @return abscissa of the nearest curve point, NaN when no candidate exists
   */
  public double locateFoot(PolynomialModel curve, PolynomialModel slope, double x, double y) {
    PolynomialModel stationarity =
        PolynomialModel.of(1.0, -x).add(curve.add(PolynomialModel.of(-y)).multiply(slope));
    double[] candidates = rootFinder.findRealRoots(stationarity);
    double best = Double.NaN;
    double bestDistance2 = Double.POSITIVE_INFINITY;
    for (double t : candidates) {
      double d2 = squaredDistance(curve, t, x, y);
      if (d2 < bestDistance2) {
        bestDistance2 = d2;
        best = t;
      }
    }
    return best;
  }

  public static double squaredDistance(PolynomialModel curve, double t, double x, double y) {
    double dx = t - x;
    double dy = curve.evaluate(t) - y;
    return dx * dx + dy * dy;
  }
}
