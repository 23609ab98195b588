package com.skyqa.locus.algorithm.util;

import java.util.OptionalDouble;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.IllinoisSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds a root of a function that is positive at a lower bound and eventually negative above it.
 *
 * <p>The upper end of the bracket starts at a caller-supplied scale and is doubled until the
 * function changes sign, then the bracket is closed with the Illinois variant of regula falsi,
 * which copes with the step discontinuities a clipped statistic produces. Convergence is declared
 * once {@code |f| <= functionTolerance} or the bracket collapses.
 */
public class BracketingRootFinder {

  private static final Logger logger = LoggerFactory.getLogger(BracketingRootFinder.class);

  /** Doublings tried when looking for the upper end of the bracket. */
  public static final int MAX_BRACKET_EXPANSIONS = 64;

  public static final int DEFAULT_MAX_EVALUATIONS = 200;

  private static final double RELATIVE_ACCURACY = 1e-12;
  private static final double ABSOLUTE_ACCURACY = 1e-300;

  private final int maxEvaluations;

  public BracketingRootFinder() {
    this(DEFAULT_MAX_EVALUATIONS);
  }

  public BracketingRootFinder(int maxEvaluations) {
    this.maxEvaluations = maxEvaluations;
  }

  /**
   * @param function function to solve, expected positive at {@code lower}
   * @param lower lower end of the search
   * @param initialScale first trial width of the bracket, must be positive
   * @param functionTolerance accuracy on the function value
   * @return the root, or empty if no bracket was found or the evaluation budget ran out
   */
  public OptionalDouble findRoot(
      UnivariateFunction function, double lower, double initialScale, double functionTolerance) {
    if (!(initialScale > 0) || !Double.isFinite(initialScale)) {
      logger.warn("Cannot bracket a root with non-positive scale {}", initialScale);
      return OptionalDouble.empty();
    }
    double upper = lower + initialScale;
    double fUpper = function.value(upper);
    int expansions = 0;
    while (!(fUpper <= 0) && expansions < MAX_BRACKET_EXPANSIONS) {
      upper = lower + (upper - lower) * 2.0;
      fUpper = function.value(upper);
      expansions++;
    }
    if (!(fUpper <= 0)) {
      logger.warn(
          "No sign change found between {} and {} after {} expansions", lower, upper, expansions);
      return OptionalDouble.empty();
    }
    if (Math.abs(fUpper) <= functionTolerance) {
      return OptionalDouble.of(upper);
    }

    IllinoisSolver solver =
        new IllinoisSolver(RELATIVE_ACCURACY, ABSOLUTE_ACCURACY, functionTolerance);
    try {
      return OptionalDouble.of(solver.solve(maxEvaluations, function, lower, upper));
    } catch (MathIllegalStateException | MathIllegalArgumentException e) {
      logger.warn("Root finding on [{}, {}] did not converge: {}", lower, upper, e.getMessage());
      return OptionalDouble.empty();
    }
  }
}
