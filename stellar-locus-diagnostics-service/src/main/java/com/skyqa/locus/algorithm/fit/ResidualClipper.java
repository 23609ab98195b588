package com.skyqa.locus.algorithm.fit;

import com.skyqa.locus.algorithm.RobustStatisticsCalculator;
import com.skyqa.locus.algorithm.util.Masks;
import com.skyqa.locus.algorithm.util.Quartiles;
import com.skyqa.locus.dto.PolynomialModel;

/**
 * Residual rejection shared by the OLS and orthogonal stages of a locus fit. A point is kept while
 * {@code |residual| <= rejection · 0.74 · IQR}, with the IQR taken over the points currently kept.
 */
final class ResidualClipper {

  /**
   * Lower bound on the threshold relative to the data scale. An exact fit has an IQR of pure
   * rounding noise, which would otherwise reject good points at random.
   */
  static final double CLIP_FLOOR_RELATIVE = 1e-9;

  private ResidualClipper() {}

  /** Half-width of the accepted residual band, which is centred on zero. */
  record Band(double threshold) {

    boolean accepts(double residual) {
      return Math.abs(residual) <= threshold;
    }
  }

  static Band band(double[] residuals, boolean[] keep, double[] y, double rejectionFactor) {
    Quartiles quartiles = Quartiles.of(Masks.select(residuals, keep));
    double clip =
        rejectionFactor * RobustStatisticsCalculator.IQR_TO_SIGMA * quartiles.interquartileRange();
    double scale = 1.0;
    for (int i = 0; i < y.length; i++) {
      if (keep[i]) {
        scale = Math.max(scale, Math.abs(y[i]));
      }
    }
    return new Band(Math.max(clip, CLIP_FLOOR_RELATIVE * scale));
  }

  /** Points of {@code base} whose residual falls inside the band. */
  static boolean[] within(double[] residuals, Band band, boolean[] base) {
    boolean[] out = new boolean[residuals.length];
    for (int i = 0; i < residuals.length; i++) {
      out[i] = base[i] && band.accepts(residuals[i]);
    }
    return out;
  }

  static double[] verticalResiduals(PolynomialModel model, double[] x, double[] y) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      out[i] = y[i] - model.evaluate(x[i]);
    }
    return out;
  }
}
