package com.skyqa.locus.algorithm.util;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * First quartile, median and third quartile of a set of values.
 *
 * <p>Uses linear interpolation between order statistics ({@link EstimationType#R_7}), the same
 * definition as the default percentile of most array libraries. An empty input gives NaN for all
 * three.
 */
public record Quartiles(double q1, double median, double q3) {

  public static Quartiles of(double[] values) {
    if (values.length == 0) {
      return new Quartiles(Double.NaN, Double.NaN, Double.NaN);
    }
    Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
    percentile.setData(values);
    return new Quartiles(
        percentile.evaluate(25.0), percentile.evaluate(50.0), percentile.evaluate(75.0));
  }

  public double interquartileRange() {
    return q3 - q1;
  }
}
