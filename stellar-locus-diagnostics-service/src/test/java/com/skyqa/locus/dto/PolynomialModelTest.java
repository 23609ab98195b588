package com.skyqa.locus.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Polynomial Model Tests")
class PolynomialModelTest {

  @Test
  @DisplayName("should evaluate with coefficients highest degree first")
  void shouldEvaluateHighestFirst() {
    PolynomialModel p = PolynomialModel.of(2.0, -3.0, 1.0);

    assertThat(p.degree()).isEqualTo(2);
    assertThat(p.evaluate(2.0)).isCloseTo(3.0, within(1e-12));
    assertThat(p.coefficientOf(1)).isEqualTo(-3.0);
    assertThat(p.coefficientOf(5)).isZero();
  }

  @Test
  @DisplayName("should build the same polynomial from ascending coefficients")
  void shouldBuildFromAscending() {
    PolynomialModel p = PolynomialModel.fromAscending(1.0, -3.0, 2.0);

    assertThat(p).isEqualTo(PolynomialModel.of(2.0, -3.0, 1.0));
    assertThat(p.ascendingCoefficients()).containsExactly(1.0, -3.0, 2.0);
  }

  @Test
  @DisplayName("should build a line from intercept and slope")
  void shouldBuildLine() {
    PolynomialModel line = PolynomialModel.line(0.5, 2.0);

    assertThat(line.coefficients()).containsExactly(2.0, 0.5);
    assertThat(line.evaluate(1.0)).isEqualTo(2.5);
  }

  @Test
  @DisplayName("should differentiate, add and multiply")
  void shouldSupportArithmetic() {
    PolynomialModel p = PolynomialModel.of(1.0, 0.0, -1.0);

    assertThat(p.derivative()).isEqualTo(PolynomialModel.of(2.0, 0.0));
    assertThat(p.add(PolynomialModel.of(1.0))).isEqualTo(PolynomialModel.of(1.0, 0.0, 0.0));
    assertThat(p.multiply(PolynomialModel.of(1.0, 1.0)))
        .isEqualTo(PolynomialModel.of(1.0, 1.0, -1.0, -1.0));
    assertThat(p.subtract(p).trimmed()).isEqualTo(PolynomialModel.of(0.0));
  }

  @Test
  @DisplayName("should keep leading zeros in the degree")
  void shouldKeepLeadingZeros() {
    PolynomialModel p = PolynomialModel.of(0.0, 1.0, 2.0);

    assertThat(p.degree()).isEqualTo(2);
    assertThat(p.trimmed().degree()).isEqualTo(1);
  }

  @Test
  @DisplayName("should keep the implied degree when arithmetic cancels the leading term")
  void shouldPadArithmeticResults() {
    PolynomialModel p = PolynomialModel.of(0.0, 1.0, 2.0);
    PolynomialModel q = PolynomialModel.of(-1.0, 3.0);

    assertThat(p.derivative()).isEqualTo(PolynomialModel.of(0.0, 1.0));
    assertThat(q.add(PolynomialModel.of(1.0, 0.0))).isEqualTo(PolynomialModel.of(0.0, 3.0));
    assertThat(p.scale(0.0).degree()).isEqualTo(2);
    assertThat(p.multiply(q).degree()).isEqualTo(3);
    assertThat(PolynomialModel.of(5.0).derivative()).isEqualTo(PolynomialModel.of(0.0));
  }

  @Test
  @DisplayName("should agree with its commons-math function")
  void shouldExposeEquivalentFunction() {
    PolynomialModel p = PolynomialModel.of(2.0, -3.0, 1.0);

    assertThat(p.asFunction().getCoefficients()).containsExactly(1.0, -3.0, 2.0);
    assertThat(p.asFunction().value(1.5)).isEqualTo(p.evaluate(1.5));
  }

  @Test
  @DisplayName("should not expose its coefficient array")
  void shouldCopyCoefficients() {
    double[] coefficients = {1.0, 2.0};
    PolynomialModel p = PolynomialModel.of(coefficients);
    coefficients[0] = 99.0;
    p.coefficients()[1] = 99.0;

    assertThat(p.coefficients()).containsExactly(1.0, 2.0);
  }

  @Test
  @DisplayName("should reject an empty coefficient list")
  void shouldRejectEmpty() {
    assertThatThrownBy(() -> PolynomialModel.of())
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should flag non-finite coefficients")
  void shouldDetectNonFinite() {
    assertThat(PolynomialModel.of(1.0, Double.NaN).isFinite()).isFalse();
    assertThat(PolynomialModel.of(1.0, 2.0).isFinite()).isTrue();
  }
}
