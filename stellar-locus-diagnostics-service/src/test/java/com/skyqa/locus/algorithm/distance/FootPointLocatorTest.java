package com.skyqa.locus.algorithm.distance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.skyqa.locus.dto.PolynomialModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Foot Point Locator Tests")
class FootPointLocatorTest {

  private final FootPointLocator locator = new FootPointLocator();

  @Test
  @DisplayName("should project onto a line")
  void shouldProjectOntoLine() {
    PolynomialModel line = PolynomialModel.of(1.0, 0.0);

    double t = locator.locateFoot(line, line.derivative(), 0.0, 1.0);

    assertThat(t).isCloseTo(0.5, within(1e-12));
  }

  @Test
  @DisplayName("should choose the closer branch of a parabola")
  void shouldChooseCloserBranch() {
    PolynomialModel parabola = PolynomialModel.of(1.0, 0.0, 0.0);

    double t = locator.locateFoot(parabola, parabola.derivative(), 0.0, 1.0);

    assertThat(Math.abs(t)).isCloseTo(Math.sqrt(0.5), within(1e-9));
    assertThat(FootPointLocator.squaredDistance(parabola, t, 0.0, 1.0))
        .isCloseTo(0.75, within(1e-9));
  }

  @Test
  @DisplayName("should return the point's own abscissa for a constant curve")
  void shouldHandleConstantCurve() {
    PolynomialModel flat = PolynomialModel.of(2.0);

    double t = locator.locateFoot(flat, flat.derivative(), 3.0, 5.0);

    assertThat(t).isCloseTo(3.0, within(1e-12));
  }
}
