package com.skyqa.locus.algorithm.fit;

import com.skyqa.locus.algorithm.util.Masks;
import com.skyqa.locus.dto.FitRegion;
import com.skyqa.locus.dto.LocusFitRequest;
import com.skyqa.locus.dto.LocusFitStrategy;
import com.skyqa.locus.dto.PolynomialModel;
import com.skyqa.locus.exception.InsufficientDataException;
import com.skyqa.locus.exception.InvalidRegionException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Iteratively clipped ordinary least-squares polynomial fit of a stellar locus, y as a function of
 * x. Its result seeds the orthogonal regression that produces the final fit.
 *
 * <p>ALGORITHM (STANDARD strategy):
 *
 * <ol>
 *   <li>keep = finite(x) ∧ finite(y) ∧ inside the fit region.
 *   <li>For each iteration: fit P by least squares over keep, residuals r = y − P(x), threshold =
 *       rejection · 0.74 · IQR(r over keep), keep = |r| ≤ threshold ∧ inside the
 *       region. After the first iteration the region is relaxed to its padded copy.
 *   <li>Refit over the final keep mask.
 * </ol>
 *
 * <p>Points rejected in one iteration can come back in the next, since every iteration clips
 * against the current polynomial. The least-squares system is solved through a singular value
 * decomposition of the Vandermonde matrix in a centred and scaled abscissa, giving the minimum-norm
 * solution when the points cannot determine every coefficient.
 *
 * <p>VERTICAL strategy: OLS of y on x is meaningless for a near-vertical locus, so the seed is the
 * caller's initial guess or, failing that, the line of slope {@value #VERTICAL_SEED_SLOPE} through
 * the first third of the x fit range. keep is the region membership.
 */
@Component
public class PolynomialLocusFitter {

  private static final Logger logger = LoggerFactory.getLogger(PolynomialLocusFitter.class);

  // ============================================================================
  // NEAR-VERTICAL SEED
  // ============================================================================

  /** Slope of the default seed line for near-vertical loci. */
  public static final double VERTICAL_SEED_SLOPE = 10.0;

  /** The default seed line crosses y = 0 this far along the x fit range. */
  private static final double VERTICAL_SEED_RANGE_FRACTION = 1.0 / 3.0;

  /** OLS stage outcome: the seed polynomial and the points it was fitted to. */
  public record SeedFit(PolynomialModel model, boolean[] keepMask, int iterations) {

    public SeedFit {
      keepMask = keepMask.clone();
    }

    @Override
    public boolean[] keepMask() {
      return keepMask.clone();
    }
  }

  /**
   * Runs the OLS stage.
   *
   * @throws InsufficientDataException if fewer points than the degree are left to fit
   * @throws InvalidRegionException for a vertical fit with neither an initial guess nor an x range
   */
  public SeedFit fitSeed(LocusFitRequest request) {
    double[] x = request.x();
    double[] y = request.y();
    int degree = request.degree();
    FitRegion region = request.region();
    boolean[] select = regionMask(region, x, y);

    if (request.strategy() == LocusFitStrategy.VERTICAL) {
      requireEnough(Masks.count(select), degree);
      PolynomialModel seed =
          request.initialGuess() != null
              ? request.initialGuess()
              : verticalSeed(region, degree);
      logger.info("Near-vertical locus: seeding orthogonal fit with {}", seed);
      return new SeedFit(seed, select, 0);
    }

    boolean[] keep = select.clone();
    PolynomialModel poly = null;
    int iteration = 0;
    for (; iteration < request.iterations(); iteration++) {
      keep = Masks.and(keep, select);
      requireEnough(Masks.count(keep), degree);
      poly = leastSquares(x, y, keep, degree);
      double[] residuals = ResidualClipper.verticalResiduals(poly, x, y);
      ResidualClipper.Band band =
          ResidualClipper.band(residuals, keep, y, request.rejectionFactor());
      keep = ResidualClipper.within(residuals, band, Masks.allTrue(x.length));
      if (iteration == 0) {
        select = regionMask(region.padded(), x, y);
      }
    }
    logger.info("Number of iterations in polynomial fit: {}", iteration);

    keep = Masks.and(keep, select);
    int kept = Masks.count(keep);
    requireEnough(kept, degree);
    poly = leastSquares(x, y, keep, degree);
    logger.debug("OLS seed {} from {} of {} points", poly, kept, x.length);
    return new SeedFit(poly, keep, iteration);
  }

  /**
   * Least-squares polynomial through the masked points, coefficients highest degree first.
   *
   * <p>The abscissa is centred on its mean and scaled by its largest deviation before building the
   * Vandermonde matrix; the fitted polynomial is then expanded back into powers of x.
   */
  public PolynomialModel leastSquares(double[] x, double[] y, boolean[] mask, int degree) {
    double[] xs = Masks.select(x, mask);
    double[] ys = Masks.select(y, mask);
    int n = xs.length;
    if (n == 0) {
      throw new InsufficientDataException("No points to fit a polynomial of degree " + degree);
    }

    double centre = 0.0;
    for (double v : xs) {
      centre += v;
    }
    centre /= n;
    double scale = 0.0;
    for (double v : xs) {
      scale = Math.max(scale, Math.abs(v - centre));
    }
    if (scale == 0.0) {
      scale = 1.0;
    }

    RealMatrix vandermonde = new Array2DRowRealMatrix(n, degree + 1);
    for (int i = 0; i < n; i++) {
      double u = (xs[i] - centre) / scale;
      double power = 1.0;
      for (int k = 0; k <= degree; k++) {
        vandermonde.setEntry(i, k, power);
        power *= u;
      }
    }
    RealVector solution =
        new SingularValueDecomposition(vandermonde).getSolver().solve(new ArrayRealVector(ys));

    // P(x) = Σ a_k·u^k with u = (x − centre)/scale, expanded by Horner's rule in u.
    PolynomialModel u = PolynomialModel.of(1.0 / scale, -centre / scale);
    PolynomialModel expanded = PolynomialModel.of(solution.getEntry(degree));
    for (int k = degree - 1; k >= 0; k--) {
      expanded = expanded.multiply(u).add(PolynomialModel.of(solution.getEntry(k)));
    }
    return expanded;
  }

  static boolean[] regionMask(FitRegion region, double[] x, double[] y) {
    boolean[] mask = new boolean[x.length];
    for (int i = 0; i < x.length; i++) {
      mask[i] = region.contains(x[i], y[i]);
    }
    return mask;
  }

  static void requireEnough(int kept, int degree) {
    if (kept < degree || kept == 0) {
      throw new InsufficientDataException(
          String.format(
              "Not enough good data points (%d) for polynomial fit of order %d", kept, degree));
    }
  }

  private static PolynomialModel verticalSeed(FitRegion region, int degree) {
    if (region.xRange() == null) {
      throw new InvalidRegionException(
          "A near-vertical fit needs an x fit range or an explicit initial guess");
    }
    FitRegion.Range xRange = region.xRange();
    double crossing = xRange.min() + xRange.span() * VERTICAL_SEED_RANGE_FRACTION;
    double[] coefficients = new double[degree + 1];
    coefficients[degree - 1] = VERTICAL_SEED_SLOPE;
    coefficients[degree] = -VERTICAL_SEED_SLOPE * crossing;
    return PolynomialModel.of(coefficients);
  }
}
