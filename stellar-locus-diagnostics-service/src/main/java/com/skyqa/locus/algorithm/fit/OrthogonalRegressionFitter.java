package com.skyqa.locus.algorithm.fit;

import com.skyqa.locus.algorithm.distance.FootPointLocator;
import com.skyqa.locus.algorithm.util.Masks;
import com.skyqa.locus.dto.LocusFitRequest;
import com.skyqa.locus.dto.LocusFitResult;
import com.skyqa.locus.dto.PolynomialModel;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Total-least-squares (orthogonal distance) refinement of a locus polynomial.
 *
 * <p>Vertical residuals describe a steep locus badly: a point a little to the side of a
 * near-vertical branch has a huge vertical residual. This fitter instead minimises the sum of
 * squared perpendicular distances from each point to the curve.
 *
 * <p>MATHEMATICAL MODEL:
 *
 * <pre>
 *   r_i(c) = (y_i − P(t_i)) · sqrt(1 + P′(t_i)²)
 * </pre>
 *
 * where {@code t_i} is the abscissa of the curve point nearest to {@code (x_i, y_i)}; {@code |r_i|}
 * is then exactly the perpendicular distance. By the envelope theorem the foot point does not move
 * to first order, so the Jacobian is
 *
 * <pre>
 *   ∂r_i/∂c_k = −t_i^k / sqrt(1 + P′(t_i)²)
 * </pre>
 *
 * with {@code c_k} the coefficient of {@code t^k}. The problem is solved with Levenberg-Marquardt.
 *
 * <p>ITERATION: round 0 fits the points kept by the OLS stage. Each of the {@code iterations − 1}
 * further rounds clips on vertical residuals from the current fit, with the OLS stage's band,
 * restricted to finite points inside the padded fit region, and refits from the previous result.
 */
@Component
public class OrthogonalRegressionFitter {

  private static final Logger logger = LoggerFactory.getLogger(OrthogonalRegressionFitter.class);

  // ============================================================================
  // OPTIMISER SETTINGS
  // ============================================================================

  private static final int MAX_EVALUATIONS = 1000;
  private static final int MAX_ITERATIONS = 1000;
  private static final double COST_RELATIVE_TOLERANCE = 1e-12;
  private static final double PARAMETER_RELATIVE_TOLERANCE = 1e-12;

  private final FootPointLocator footPointLocator;

  public OrthogonalRegressionFitter() {
    this(new FootPointLocator());
  }

  OrthogonalRegressionFitter(FootPointLocator footPointLocator) {
    this.footPointLocator = footPointLocator;
  }

  /**
   * Refines {@code seed} into the final locus fit.
   *
   * @throws com.skyqa.locus.exception.InsufficientDataException if a clip round leaves fewer
   *     points than the degree
   */
  public LocusFitResult refine(LocusFitRequest request, PolynomialLocusFitter.SeedFit seed) {
    double[] x = request.x();
    double[] y = request.y();
    int degree = request.degree();
    boolean[] finite = Masks.finite(x, y);
    boolean[] paddedRegion = PolynomialLocusFitter.regionMask(request.region().padded(), x, y);

    boolean[] keep = seed.keepMask();
    PolynomialLocusFitter.requireEnough(Masks.count(keep), degree);
    PolynomialModel model = fit(x, y, keep, seed.model());

    for (int round = 0; round < request.iterations() - 1; round++) {
      double[] residuals = ResidualClipper.verticalResiduals(model, x, y);
      ResidualClipper.Band band =
          ResidualClipper.band(residuals, keep, y, request.rejectionFactor());
      keep = ResidualClipper.within(residuals, band, Masks.and(finite, paddedRegion));
      PolynomialLocusFitter.requireEnough(Masks.count(keep), degree);
      model = fit(x, y, keep, model);
    }
    logger.info("Orthogonal regression fit {} from {} points", model, Masks.count(keep));
    return new LocusFitResult(model, seed.model(), keep, seed.keepMask(), request.iterations());
  }

  /**
   * One orthogonal least-squares solve over the masked points. Keeps the starting coefficients when
   * the points cannot constrain them or the optimiser runs out of budget.
   */
  public PolynomialModel fit(double[] x, double[] y, boolean[] mask, PolynomialModel start) {
    double[] xs = Masks.select(x, mask);
    double[] ys = Masks.select(y, mask);
    int n = xs.length;
    int parameters = start.degree() + 1;
    if (n < parameters) {
      logger.debug("{} points cannot constrain {} coefficients, keeping {}", n, parameters, start);
      return start;
    }

    MultivariateJacobianFunction perpendicularResiduals =
        point -> {
          PolynomialModel curve = PolynomialModel.fromAscending(point.toArray());
          PolynomialModel slope = curve.derivative();
          RealVector value = new ArrayRealVector(n);
          RealMatrix jacobian = new Array2DRowRealMatrix(n, parameters);
          for (int i = 0; i < n; i++) {
            double t = footPointLocator.locateFoot(curve, slope, xs[i], ys[i]);
            if (Double.isNaN(t)) {
              t = xs[i];
            }
            double norm = Math.sqrt(1.0 + Math.pow(slope.evaluate(t), 2));
            value.setEntry(i, (ys[i] - curve.evaluate(t)) * norm);
            double power = 1.0;
            for (int k = 0; k < parameters; k++) {
              jacobian.setEntry(i, k, -power / norm);
              power *= t;
            }
          }
          return new Pair<>(value, jacobian);
        };

    LeastSquaresProblem problem =
        new LeastSquaresBuilder()
            .start(start.ascendingCoefficients())
            .model(perpendicularResiduals)
            .target(new double[n])
            .lazyEvaluation(false)
            .maxEvaluations(MAX_EVALUATIONS)
            .maxIterations(MAX_ITERATIONS)
            .build();

    try {
      LeastSquaresOptimizer.Optimum optimum =
          new LevenbergMarquardtOptimizer()
              .withCostRelativeTolerance(COST_RELATIVE_TOLERANCE)
              .withParameterRelativeTolerance(PARAMETER_RELATIVE_TOLERANCE)
              .optimize(problem);
      PolynomialModel result = PolynomialModel.fromAscending(optimum.getPoint().toArray());
      if (!result.isFinite()) {
        logger.warn("Orthogonal regression diverged from {}, keeping the starting fit", start);
        return start;
      }
      logger.debug(
          "Orthogonal regression converged after {} iterations, rms {}",
          optimum.getIterations(),
          optimum.getRMS());
      return result;
    } catch (MathIllegalStateException e) {
      logger.warn(
          "Orthogonal regression did not converge ({}), keeping the starting fit {}",
          e.getMessage(),
          start);
      return start;
    }
  }
}
