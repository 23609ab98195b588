package com.skyqa.locus.algorithm.fit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.skyqa.locus.dto.FitRegion;
import com.skyqa.locus.dto.LocusFitRequest;
import com.skyqa.locus.dto.LocusFitStrategy;
import com.skyqa.locus.dto.PolynomialModel;
import com.skyqa.locus.exception.InsufficientDataException;
import com.skyqa.locus.exception.InvalidRegionException;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Polynomial Locus Fitter Tests")
class PolynomialLocusFitterTest {

  private PolynomialLocusFitter fitter;

  @BeforeEach
  void setUp() {
    fitter = new PolynomialLocusFitter();
  }

  @Nested
  @DisplayName("Ordinary Least Squares Stage")
  class OrdinaryLeastSquaresTests {

    @Test
    @DisplayName("should reproduce an exact quadratic and keep every point")
    void shouldFitExactQuadratic() {
      double[] x = new double[10];
      double[] y = new double[10];
      for (int i = 0; i < 10; i++) {
        x[i] = i;
        y[i] = i * i;
      }

      PolynomialLocusFitter.SeedFit seed = fitter.fitSeed(LocusFitRequest.of(x, y, 2));

      assertThat(seed.model().coefficients())
          .containsExactly(new double[] {1.0, 0.0, 0.0}, within(1e-8));
      assertThat(seed.keepMask()).containsOnly(true);
      assertThat(seed.iterations()).isEqualTo(LocusFitRequest.DEFAULT_ITERATIONS);
    }

    @Test
    @DisplayName("should reject gross outliers on both sides of the locus")
    void shouldRejectOutliers() {
      double[] x = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 4.5, 4.5};
      double[] y = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 44.5, -35.5};

      PolynomialLocusFitter.SeedFit seed = fitter.fitSeed(LocusFitRequest.of(x, y, 1));

      boolean[] keep = seed.keepMask();
      assertThat(keep[10]).isFalse();
      assertThat(keep[11]).isFalse();
      for (int i = 0; i < 10; i++) {
        assertThat(keep[i]).as("point %d", i).isTrue();
      }
      assertThat(seed.model().coefficients())
          .containsExactly(new double[] {1.0, 0.0}, within(1e-8));
    }

    @Test
    @DisplayName("should drop a lone outlier from the first clipped mask")
    void shouldDropOutlierInFirstIteration() {
      double[] x = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 5};
      double[] y = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 100};
      boolean[] all = new boolean[x.length];
      Arrays.fill(all, true);

      PolynomialModel first = fitter.leastSquares(x, y, all, 1);
      double[] residuals = ResidualClipper.verticalResiduals(first, x, y);
      ResidualClipper.Band band = ResidualClipper.band(residuals, all, y, 3.0);

      assertThat(ResidualClipper.within(residuals, band, all)[10]).isFalse();
    }

    @Test
    @DisplayName("should give up when one outlier drags the line off every point")
    void shouldRunOutOfPointsWhenOutlierShiftsLine() {
      double[] x = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 5};
      double[] y = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 100};
      LocusFitRequest request = LocusFitRequest.of(x, y, 1).withIterations(1);

      assertThatThrownBy(() -> fitter.fitSeed(request))
          .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("should ignore points outside the fit region")
    void shouldRestrictToRegion() {
      double[] x = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};
      double[] y = {0, 1, 2, 3, 4, 50, 60, 70, 80, 90};
      FitRegion region = FitRegion.builder().xRange(FitRegion.Range.of(-0.5, 4.2)).build();

      PolynomialLocusFitter.SeedFit seed =
          fitter.fitSeed(LocusFitRequest.of(x, y, 1).withRegion(region));

      assertThat(seed.model().coefficients())
          .containsExactly(new double[] {1.0, 0.0}, within(1e-8));
      assertThat(seed.keepMask())
          .containsExactly(true, true, true, true, true, false, false, false, false, false);
    }

    @Test
    @DisplayName("should throw when too few points are left")
    void shouldThrowForInsufficientData() {
      LocusFitRequest request = LocusFitRequest.of(new double[] {0, 1}, new double[] {0, 1}, 3);

      assertThatThrownBy(() -> fitter.fitSeed(request))
          .isInstanceOf(InsufficientDataException.class)
          .hasMessageContaining("order 3");
    }

    @Test
    @DisplayName("should throw when every point is non-finite")
    void shouldThrowForAllNaN() {
      LocusFitRequest request =
          LocusFitRequest.of(
              new double[] {Double.NaN, Double.NaN}, new double[] {1.0, 2.0}, 1);

      assertThatThrownBy(() -> fitter.fitSeed(request))
          .isInstanceOf(InsufficientDataException.class);
    }
  }

  @Nested
  @DisplayName("Vertical Strategy")
  class VerticalStrategyTests {

    @Test
    @DisplayName("should seed a steep line through the first third of the x range")
    void shouldSeedFromRange() {
      double[] x = {1.1, 1.2, 1.3};
      double[] y = {1.0, 1.1, 1.2};
      FitRegion region = FitRegion.builder().xRange(FitRegion.Range.of(1.05, 1.45)).build();
      LocusFitRequest request =
          LocusFitRequest.of(x, y, 1)
              .withRegion(region)
              .withStrategy(LocusFitStrategy.VERTICAL);

      PolynomialLocusFitter.SeedFit seed = fitter.fitSeed(request);

      double crossing = 1.05 + 0.4 / 3.0;
      assertThat(seed.model().coefficients())
          .containsExactly(
              new double[] {PolynomialLocusFitter.VERTICAL_SEED_SLOPE, -10.0 * crossing},
              within(1e-12));
      assertThat(seed.keepMask()).containsOnly(true);
      assertThat(seed.iterations()).isZero();
    }

    @Test
    @DisplayName("should prefer an explicit initial guess")
    void shouldUseInitialGuess() {
      PolynomialModel guess = PolynomialModel.of(11.4, -12.5);
      LocusFitRequest request =
          LocusFitRequest.of(new double[] {1.0, 1.2}, new double[] {0.9, 1.3}, 1)
              .withStrategy(LocusFitStrategy.VERTICAL)
              .withInitialGuess(guess);

      assertThat(fitter.fitSeed(request).model()).isEqualTo(guess);
    }

    @Test
    @DisplayName("should need an x range or a guess")
    void shouldRequireRangeOrGuess() {
      LocusFitRequest request =
          LocusFitRequest.of(new double[] {1.0, 1.2}, new double[] {0.9, 1.3}, 1)
              .withStrategy(LocusFitStrategy.VERTICAL);

      assertThatThrownBy(() -> fitter.fitSeed(request))
          .isInstanceOf(InvalidRegionException.class);
    }
  }

  @Nested
  @DisplayName("Least Squares Solve")
  class LeastSquaresTests {

    @Test
    @DisplayName("should fit a cubic far from the origin")
    void shouldFitOffsetCubic() {
      Random random = new Random(11);
      double[] x = new double[50];
      double[] y = new double[50];
      boolean[] mask = new boolean[50];
      PolynomialModel truth = PolynomialModel.of(0.5, -1.0, 2.0, 3.0);
      for (int i = 0; i < x.length; i++) {
        x[i] = 100.0 + random.nextDouble();
        y[i] = truth.evaluate(x[i]);
        mask[i] = true;
      }

      PolynomialModel fitted = fitter.leastSquares(x, y, mask, 3);

      for (double probe : new double[] {100.1, 100.5, 100.9}) {
        assertThat(fitted.evaluate(probe))
            .isCloseTo(truth.evaluate(probe), within(1e-6 * Math.abs(truth.evaluate(probe))));
      }
    }
  }
}
