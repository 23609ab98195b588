package com.skyqa.locus.algorithm;

import com.skyqa.locus.algorithm.util.BracketingRootFinder;
import com.skyqa.locus.algorithm.util.Masks;
import com.skyqa.locus.dto.ScalarSample;
import java.util.OptionalDouble;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Solves for the additive systematic error that makes error-normalised residuals unit-scattered.
 *
 * <p>For a trial variance s² the quantity {@code value / sqrt(error² + s²)} is summarised with
 * {@link RobustStatisticsCalculator}; the solver looks for the s² at which its clipped stdev is 1
 * and returns {@code s}. When the scatter is already at or below 1 with no extra term the answer is
 * zero. A solver that cannot bracket or converge gives NaN and a warning, never an exception.
 */
@Component
public class SystematicErrorSolver {

  private static final Logger logger = LoggerFactory.getLogger(SystematicErrorSolver.class);

  public static final double DEFAULT_TOLERANCE = 1e-3;

  /** Starting point used when the quantity cannot be normalised at s² = 0 (zero errors). */
  private static final double TINY_VARIANCE_FRACTION = 1e-12;

  private final RobustStatisticsCalculator statisticsCalculator;
  private final BracketingRootFinder rootFinder;

  @Autowired
  public SystematicErrorSolver(RobustStatisticsCalculator statisticsCalculator) {
    this(statisticsCalculator, new BracketingRootFinder());
  }

  SystematicErrorSolver(
      RobustStatisticsCalculator statisticsCalculator, BracketingRootFinder rootFinder) {
    this.statisticsCalculator = statisticsCalculator;
    this.rootFinder = rootFinder;
  }

  public double solveSystematicError(
      double[] values, double[] errors, boolean[] selection, Double forcedMean, double tolerance) {
    return solveSystematicError(
        new ScalarSample(values, null, errors, selection),
        RobustStatisticsCalculator.DEFAULT_CLIP_FACTOR,
        forcedMean,
        tolerance);
  }

  /**
   * @return systematic error in the units of the sample values, 0 when none is needed, NaN when the
   *     solve fails
   * @throws IllegalArgumentException if the sample carries no errors
   */
  public double solveSystematicError(
      ScalarSample sample, double clipFactor, Double forcedMean, double tolerance) {
    if (!sample.hasErrors()) {
      throw new IllegalArgumentException("Systematic error needs per-object errors");
    }
    double[] values = sample.values();
    double[] errors = sample.errors();
    UnivariateFunction excessScatter =
        sysErr2 -> {
          double[] normalised = new double[values.length];
          for (int i = 0; i < values.length; i++) {
            normalised[i] = values[i] / Math.sqrt(errors[i] * errors[i] + sysErr2);
          }
          return statisticsCalculator
                  .computeRobustStatistics(sample.withValues(normalised), clipFactor, forcedMean)
                  .stdev()
              - 1.0;
        };

    double scale = selectedVariance(sample);
    double lower = 0.0;
    double fLower = excessScatter.value(lower);
    if (!Double.isFinite(fLower)) {
      lower = scale * TINY_VARIANCE_FRACTION;
      fLower = excessScatter.value(lower);
    }
    if (Double.isNaN(fLower)) {
      logger.warn("sysErr calculation failed: scatter is undefined for this sample");
      return Double.NaN;
    }
    if (fLower <= tolerance) {
      return Math.sqrt(lower);
    }

    OptionalDouble root = rootFinder.findRoot(excessScatter, lower, scale, tolerance);
    if (root.isEmpty()) {
      logger.warn("sysErr calculation failed: no converged root for {} objects", sample.size());
      return Double.NaN;
    }
    double sysErr = Math.sqrt(Math.max(0.0, root.getAsDouble()));
    logger.debug("sysErr={} (residual scatter {})", sysErr, excessScatter.value(sysErr * sysErr));
    return sysErr;
  }

  /** Variance of the selected values, used as the first bracket width; 1 if it is not positive. */
  private static double selectedVariance(ScalarSample sample) {
    boolean[] selected = new boolean[sample.size()];
    for (int i = 0; i < selected.length; i++) {
      selected[i] = sample.isSelected(i);
    }
    double[] chosen = Masks.select(sample.values(), selected);
    if (chosen.length < 2) {
      return 1.0;
    }
    double mean = 0.0;
    for (double v : chosen) {
      mean += v;
    }
    mean /= chosen.length;
    double sum = 0.0;
    for (double v : chosen) {
      sum += (v - mean) * (v - mean);
    }
    double variance = sum / chosen.length;
    return variance > 0 && Double.isFinite(variance) ? variance : 1.0;
  }
}
