package com.skyqa.locus.algorithm.fit;

import com.skyqa.locus.algorithm.util.PolynomialRealRootFinder;
import com.skyqa.locus.dto.FitLine;
import com.skyqa.locus.dto.FitRegion;
import com.skyqa.locus.dto.PolynomialModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks that configured bounding lines still cut the fitted locus at right angles.
 *
 * <p>Bounding lines are meant to be perpendicular to the locus where they cross it. For each line
 * the crossing with the fit is found, and the perpendicular to the fit at that point is compared
 * with the configured line. An intercept or slope differing by more than
 * {@value #TOLERANCE_PERCENT}% is reported with the suggested replacement, so stale hard-wired
 * lines are noticed when the photometry changes. When a line does not cross the fit, the matching
 * end of the x fit range stands in for the crossing.
 */
@Component
public class FitLineConsistencyChecker {

  private static final Logger logger = LoggerFactory.getLogger(FitLineConsistencyChecker.class);

  /** Allowed symmetric percentage difference, {@code 200·|a − b| / |a + b|}. */
  public static final double TOLERANCE_PERCENT = 5.0;

  private final PolynomialRealRootFinder rootFinder;

  public FitLineConsistencyChecker() {
    this.rootFinder = new PolynomialRealRootFinder();
  }

  /**
   * @return one message per inconsistent line; empty when both agree with the fit
   */
  public List<String> check(PolynomialModel fit, FitRegion region) {
    List<String> messages = new ArrayList<>();
    if (region.upperLine() != null) {
      checkLine("Upper", fit, region.upperLine(), region.xRange(), true).ifPresent(messages::add);
    }
    if (region.lowerLine() != null) {
      checkLine("Lower", fit, region.lowerLine(), region.xRange(), false).ifPresent(messages::add);
    }
    return messages;
  }

  private Optional<String> checkLine(
      String branch, PolynomialModel fit, FitLine line, FitRegion.Range xRange, boolean upper) {
    double crossing = crossing(fit, line, xRange, upper);
    if (Double.isNaN(crossing)) {
      logger.warn("{} bounding line does not cross the fit and no x fit range is set", branch);
      return Optional.empty();
    }
    double localSlope = fit.derivative().evaluate(crossing);
    if (localSlope == 0.0) {
      return Optional.empty();
    }
    double perpendicularSlope = -1.0 / localSlope;
    double perpendicularIntercept = fit.evaluate(crossing) - perpendicularSlope * crossing;
    if (differsBy(line.intercept(), perpendicularIntercept)
        || differsBy(line.slope(), perpendicularSlope)) {
      String message =
          String.format(
              Locale.ROOT,
              "%s bounding line [%.3f, %.3f] does not match the local slope of the fit; consider"
                  + " [%.3f, %.3f] (line crosses fit at x = %.2f)",
              branch,
              line.intercept(),
              line.slope(),
              perpendicularIntercept,
              perpendicularSlope,
              crossing);
      logger.warn(message);
      return Optional.of(message);
    }
    return Optional.empty();
  }

  /** Crossing nearest the middle of the x fit range, or any crossing without one. */
  private double crossing(
      PolynomialModel fit, FitLine line, FitRegion.Range xRange, boolean upper) {
    PolynomialModel difference =
        fit.subtract(PolynomialModel.line(line.intercept(), line.slope()));
    double[] roots = rootFinder.findRealRoots(difference);
    if (roots.length == 0) {
      if (xRange == null) {
        return Double.NaN;
      }
      logger.warn(
          "{} bounding line does not cross the fit, using x = {}",
          upper ? "Upper" : "Lower",
          upper ? xRange.max() : xRange.min());
      return upper ? xRange.max() : xRange.min();
    }
    if (xRange == null) {
      return roots[0];
    }
    double centre = 0.5 * (xRange.min() + xRange.max());
    double best = roots[0];
    for (double root : roots) {
      if (Math.abs(root - centre) < Math.abs(best - centre)) {
        best = root;
      }
    }
    return best;
  }

  private static boolean differsBy(double configured, double derived) {
    double sum = configured + derived;
    if (sum == 0.0) {
      return configured != derived;
    }
    return Math.abs(200.0 * (configured - derived) / sum) > TOLERANCE_PERCENT;
  }
}
