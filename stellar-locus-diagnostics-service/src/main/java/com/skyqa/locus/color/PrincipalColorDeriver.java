package com.skyqa.locus.color;

import com.skyqa.locus.dto.PolynomialModel;
import com.skyqa.locus.dto.PrincipalColorCoefficients;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives principal-color coefficients from a straight-line locus fit.
 *
 * <p>In the plane x = b1 − b2, y = b2 − b3 a linear fit {@code y = m·x + b} defines a direction
 * θ = atan(m). Rotating the plane by θ gives
 *
 * <pre>
 *   P1 =  cosθ·(x − x0) + sinθ·(y − y0)    along the locus
 *   P2 = −sinθ·(x − x0) + cosθ·(y − y0)    across the locus
 * </pre>
 *
 * Expanded in the three bands and normalised to a unit coefficient vector, these are the
 * Ivezic-style principal colors. The origin {@code (x0, y0)} is the foot of the perpendicular from
 * the densest part of the locus onto the fitted line, so both colors vanish there.
 */
@Component
public class PrincipalColorDeriver {

  private static final Logger logger = LoggerFactory.getLogger(PrincipalColorDeriver.class);

  /** Neighbour radius for the density estimate, as a fraction of the larger coordinate span. */
  public static final double DEFAULT_DENSITY_RADIUS_FRACTION = 0.05;

  /**
   * @param linearFit degree-1 fit of y on x
   * @param xReference x of the reference point, normally the highest-density star
   * @param yReference y of the reference point
   * @throws IllegalArgumentException if the fit is not a straight line
   */
  public PrincipalColorCoefficients derive(
      String band1,
      String band2,
      String band3,
      PolynomialModel linearFit,
      double xReference,
      double yReference) {
    if (linearFit.degree() != 1) {
      throw new IllegalArgumentException(
          "Principal colors need a straight-line fit, got degree " + linearFit.degree());
    }
    double m = linearFit.coefficientOf(1);
    double b = linearFit.coefficientOf(0);
    double x0 = (xReference + m * (yReference - b)) / (m * m + 1.0);
    double y0 = (m * (xReference + m * yReference) + b) / (m * m + 1.0);

    double theta = Math.atan(m);
    double cos = Math.cos(theta);
    double sin = Math.sin(theta);

    double[] p1 = {cos, sin - cos, -sin};
    double p1Constant = -(cos * x0 + sin * y0);
    double[] p2 = {-sin, sin + cos, -cos};
    double p2Constant = sin * x0 - cos * y0;

    double p1Norm = norm(p1);
    double p2Norm = norm(p2);
    logger.info("P1/P2 origin x, y: {} {}", x0, y0);
    return new PrincipalColorCoefficients(
        bandMap(band1, band2, band3, p1, p1Norm),
        p1Constant / p1Norm,
        bandMap(band1, band2, band3, p2, p2Norm),
        p2Constant / p2Norm,
        x0,
        y0);
  }

  /**
   * Kept point with the most kept neighbours within {@code radiusFraction} of the larger coordinate
   * span; the first such point on ties.
   *
   * @return {@code {x, y}}, or NaNs when no point is kept
   */
  public double[] highestDensityPoint(
      double[] x, double[] y, boolean[] keep, double radiusFraction) {
    double minX = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < x.length; i++) {
      if (keep[i]) {
        minX = Math.min(minX, x[i]);
        maxX = Math.max(maxX, x[i]);
        minY = Math.min(minY, y[i]);
        maxY = Math.max(maxY, y[i]);
      }
    }
    if (minX > maxX) {
      return new double[] {Double.NaN, Double.NaN};
    }
    double radius = radiusFraction * Math.max(maxX - minX, maxY - minY);
    double radius2 = radius * radius;

    int best = -1;
    int bestCount = -1;
    for (int i = 0; i < x.length; i++) {
      if (!keep[i]) {
        continue;
      }
      int count = 0;
      for (int j = 0; j < x.length; j++) {
        if (keep[j]) {
          double dx = x[j] - x[i];
          double dy = y[j] - y[i];
          if (dx * dx + dy * dy <= radius2) {
            count++;
          }
        }
      }
      if (count > bestCount) {
        bestCount = count;
        best = i;
      }
    }
    logger.info("Highest density point x, y: {} {}", x[best], y[best]);
    return new double[] {x[best], y[best]};
  }

  private static Map<String, Double> bandMap(
      String band1, String band2, String band3, double[] coefficients, double norm) {
    Map<String, Double> m = new LinkedHashMap<>();
    m.put(band1, coefficients[0] / norm);
    m.put(band2, coefficients[1] / norm);
    m.put(band3, coefficients[2] / norm);
    return m;
  }

  private static double norm(double[] v) {
    double sum = 0.0;
    for (double c : v) {
      sum += c * c;
    }
    return Math.sqrt(sum);
  }
}
