package com.skyqa.locus.algorithm.util;

import com.skyqa.locus.dto.PolynomialModel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts every real root of a real polynomial.
 *
 * <p>Roots are isolated with a Sturm sequence: the number of distinct real roots in {@code (a, b]}
 * is the drop in sign changes of the sequence between {@code a} and {@code b}. The Cauchy bound
 * gives a starting interval that contains all roots, which is bisected until every sub-interval
 * holds exactly one. Each isolated root is then refined with Brent's method when the interval
 * brackets a sign change, or by continued Sturm bisection when it does not (roots of even
 * multiplicity).
 *
 * <p>Degrees one and two use closed forms. Leading coefficients that are negligible next to the
 * rest are dropped before anything else, so a nominal quintic whose top terms cancel is handled as
 * the lower-degree polynomial it really is.
 *
 * <p>Instances are stateless and thread-safe.
 */
public class PolynomialRealRootFinder {

  private static final Logger logger = LoggerFactory.getLogger(PolynomialRealRootFinder.class);

  // ============================================================================
  // NUMERICAL CONSTANTS
  // ============================================================================

  /** Leading coefficients below this fraction of the largest coefficient are treated as zero. */
  private static final double LEADING_COEFFICIENT_EPSILON = 1e-14;

  /** Remainders below this fraction of their dividend end the Sturm sequence. */
  private static final double STURM_REMAINDER_EPSILON = 1e-12;

  /** Isolation stops once an interval is narrower than this, relative to its magnitude. */
  private static final double INTERVAL_RELATIVE_WIDTH = 1e-13;

  /** Hard cap on isolation bisections so a pathological sequence can never loop forever. */
  private static final int MAX_ISOLATION_STEPS = 10_000;

  private static final int MAX_BRENT_EVALUATIONS = 200;

  private final BrentSolver refiner = new BrentSolver(1e-15, 1e-15);

  /**
   * Returns the distinct real roots of {@code polynomial}, sorted ascending. A constant polynomial
   * has no roots (the identically zero polynomial included).
   */
  public double[] findRealRoots(PolynomialModel polynomial) {
    double[] coefficients = dropNegligibleLeading(polynomial.coefficients());
    int degree = coefficients.length - 1;
    if (degree <= 0) {
      return new double[0];
    }
    if (degree == 1) {
      return new double[] {-coefficients[1] / coefficients[0]};
    }
    if (degree == 2) {
      return quadraticRoots(coefficients[0], coefficients[1], coefficients[2]);
    }
    return sturmRoots(PolynomialModel.of(coefficients));
  }

  // ============================================================================
  // CLOSED FORMS
  // ============================================================================

  private double[] quadraticRoots(double a, double b, double c) {
    double discriminant = b * b - 4.0 * a * c;
    double scale = Math.max(b * b, Math.abs(4.0 * a * c));
    if (discriminant < 0) {
      // Rounding can push a double root slightly negative.
      if (-discriminant <= 1e-14 * scale) {
        return new double[] {-b / (2.0 * a)};
      }
      return new double[0];
    }
    if (discriminant == 0) {
      return new double[] {-b / (2.0 * a)};
    }
    // Numerically stable form avoiding cancellation between -b and the square root.
    double q = -0.5 * (b + Math.copySign(Math.sqrt(discriminant), b));
    double r1 = q / a;
    double r2 = q != 0.0 ? c / q : -r1;
    return r1 < r2 ? new double[] {r1, r2} : new double[] {r2, r1};
  }

  // ============================================================================
  // STURM ISOLATION
  // ============================================================================

  private double[] sturmRoots(PolynomialModel p) {
    List<PolynomialModel> sequence = sturmSequence(p);
    double bound = cauchyBound(p.coefficients());
    double lo = -bound;
    double hi = bound;

    List<Double> roots = new ArrayList<>();
    Deque<double[]> pending = new ArrayDeque<>();
    pending.push(new double[] {lo, hi});
    int steps = 0;
    while (!pending.isEmpty() && steps++ < MAX_ISOLATION_STEPS) {
      double[] interval = pending.pop();
      double a = interval[0];
      double b = interval[1];
      int count = signChanges(sequence, a) - signChanges(sequence, b);
      if (count <= 0) {
        continue;
      }
      if (count == 1) {
        roots.add(refine(p, sequence, a, b));
        continue;
      }
      double mid = 0.5 * (a + b);
      if (isNarrow(a, b)) {
        roots.add(mid);
        continue;
      }
      pending.push(new double[] {a, mid});
      pending.push(new double[] {mid, b});
    }

    if (roots.isEmpty() && p.degree() % 2 == 1) {
      // An odd degree always has a real root; fall back to a plain bracket over the bound.
      logger.debug("Sturm isolation found no root for odd-degree {}, bisecting the bound", p);
      roots.add(bracketedRoot(p, lo, hi));
    }
    return roots.stream().mapToDouble(Double::doubleValue).sorted().distinct().toArray();
  }

  /** Refines the single distinct root in {@code (a, b]}. */
  private double refine(PolynomialModel p, List<PolynomialModel> sequence, double a, double b) {
    for (int i = 0; i < MAX_ISOLATION_STEPS; i++) {
      double fa = p.evaluate(a);
      double fb = p.evaluate(b);
      if (fb == 0.0) {
        return b;
      }
      if (Math.signum(fa) * Math.signum(fb) < 0) {
        return bracketedRoot(p, a, b);
      }
      if (isNarrow(a, b)) {
        return 0.5 * (a + b);
      }
      double mid = 0.5 * (a + b);
      if (signChanges(sequence, a) - signChanges(sequence, mid) >= 1) {
        b = mid;
      } else {
        a = mid;
      }
    }
    return 0.5 * (a + b);
  }

  private double bracketedRoot(PolynomialModel p, double a, double b) {
    PolynomialFunction function = p.asFunction();
    try {
      return refiner.solve(MAX_BRENT_EVALUATIONS, function, a, b);
    } catch (MathIllegalStateException | IllegalArgumentException e) {
      logger.debug("Brent refinement failed on [{}, {}]: {}", a, b, e.getMessage());
      return bisect(p, a, b);
    }
  }

  private double bisect(PolynomialModel p, double a, double b) {
    double fa = p.evaluate(a);
    for (int i = 0; i < 200 && !isNarrow(a, b); i++) {
      double mid = 0.5 * (a + b);
      double fm = p.evaluate(mid);
      if (fm == 0.0) {
        return mid;
      }
      if (Math.signum(fm) == Math.signum(fa)) {
        a = mid;
        fa = fm;
      } else {
        b = mid;
      }
    }
    return 0.5 * (a + b);
  }

  private static boolean isNarrow(double a, double b) {
    return b - a <= INTERVAL_RELATIVE_WIDTH * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
  }

  static List<PolynomialModel> sturmSequence(PolynomialModel p) {
    List<PolynomialModel> sequence = new ArrayList<>();
    sequence.add(p);
    PolynomialModel derivative = p.derivative();
    sequence.add(derivative);
    PolynomialModel previous = p;
    PolynomialModel current = derivative;
    while (current.degree() > 0) {
      double[] remainder = remainder(previous.coefficients(), current.coefficients());
      double dividendNorm = maxAbs(previous.coefficients());
      if (maxAbs(remainder) <= STURM_REMAINDER_EPSILON * dividendNorm) {
        break;
      }
      PolynomialModel next = PolynomialModel.of(dropNegligibleLeading(remainder)).scale(-1.0);
      sequence.add(next);
      previous = current;
      current = next;
    }
    return sequence;
  }

  static int signChanges(List<PolynomialModel> sequence, double x) {
    int changes = 0;
    double last = 0.0;
    for (PolynomialModel q : sequence) {
      double value = q.evaluate(x);
      if (value == 0.0) {
        continue;
      }
      if (last != 0.0 && Math.signum(value) != Math.signum(last)) {
        changes++;
      }
      last = value;
    }
    return changes;
  }

  /** Remainder of polynomial long division, coefficients highest first. */
  private static double[] remainder(double[] dividend, double[] divisor) {
    double[] work = dividend.clone();
    int divisorDegree = divisor.length - 1;
    for (int i = 0; i + divisorDegree < work.length; i++) {
      double factor = work[i] / divisor[0];
      for (int j = 0; j <= divisorDegree; j++) {
        work[i + j] -= factor * divisor[j];
      }
    }
    int remainderLength = Math.max(1, divisorDegree);
    return Arrays.copyOfRange(work, work.length - remainderLength, work.length);
  }

  /** Every real root lies within {@code (-bound, bound)}. */
  private static double cauchyBound(double[] coefficients) {
    double max = 0.0;
    for (int i = 1; i < coefficients.length; i++) {
      max = Math.max(max, Math.abs(coefficients[i] / coefficients[0]));
    }
    // Widen a little so no root sits exactly on an endpoint.
    return (1.0 + max) * 1.01;
  }

  private static double[] dropNegligibleLeading(double[] coefficients) {
    double max = maxAbs(coefficients);
    if (max == 0.0) {
      return new double[] {0.0};
    }
    int first = 0;
    while (first < coefficients.length - 1
        && Math.abs(coefficients[first]) <= LEADING_COEFFICIENT_EPSILON * max) {
      first++;
    }
    return Arrays.copyOfRange(coefficients, first, coefficients.length);
  }

  private static double maxAbs(double[] values) {
    double max = 0.0;
    for (double v : values) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }
}
