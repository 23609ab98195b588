package com.skyqa.locus.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.skyqa.locus.dto.ScalarSample;
import java.util.Arrays;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Systematic Error Solver Tests")
class SystematicErrorSolverTest {

  private static final int SAMPLE_SIZE = 20000;

  private SystematicErrorSolver solver;

  @BeforeEach
  void setUp() {
    solver = new SystematicErrorSolver(new RobustStatisticsCalculator());
  }

  private static double[] gaussian(long seed, double sigma) {
    Random random = new Random(seed);
    double[] values = new double[SAMPLE_SIZE];
    for (int i = 0; i < values.length; i++) {
      values[i] = sigma * random.nextGaussian();
    }
    return values;
  }

  private static double[] filled(double value) {
    double[] out = new double[SAMPLE_SIZE];
    Arrays.fill(out, value);
    return out;
  }

  private static boolean[] all() {
    boolean[] out = new boolean[SAMPLE_SIZE];
    Arrays.fill(out, true);
    return out;
  }

  @Test
  @DisplayName("should find no systematic error when errors explain the scatter")
  void shouldReturnNearZeroForUnitScatter() {
    double sysErr =
        solver.solveSystematicError(gaussian(1, 1.0), filled(1.0), all(), null, 1e-3);

    assertThat(sysErr).isBetween(0.0, 0.2);
  }

  @Test
  @DisplayName("should return exactly zero when errors overstate the scatter")
  void shouldReturnZeroForOverstatedErrors() {
    double sysErr =
        solver.solveSystematicError(gaussian(2, 1.0), filled(2.0), all(), null, 1e-3);

    assertThat(sysErr).isZero();
  }

  @Test
  @DisplayName("should recover a known systematic error")
  void shouldRecoverKnownSystematicError() {
    double error = 0.5;
    double systematic = 0.3;
    double[] values = gaussian(3, Math.sqrt(error * error + systematic * systematic));

    double sysErr = solver.solveSystematicError(values, filled(error), all(), null, 1e-3);

    assertThat(sysErr).isCloseTo(systematic, within(0.03));
  }

  @Test
  @DisplayName("should return NaN when nothing is selected")
  void shouldReturnNaNForEmptySelection() {
    double sysErr =
        solver.solveSystematicError(
            gaussian(4, 1.0), filled(1.0), new boolean[SAMPLE_SIZE], null, 1e-3);

    assertThat(sysErr).isNaN();
  }

  @Test
  @DisplayName("should require per-object errors")
  void shouldRejectSampleWithoutErrors() {
    ScalarSample sample = ScalarSample.of(new double[] {1.0, 2.0});

    assertThatThrownBy(() -> solver.solveSystematicError(sample, 4.0, null, 1e-3))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
