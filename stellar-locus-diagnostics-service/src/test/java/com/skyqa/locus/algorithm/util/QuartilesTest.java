package com.skyqa.locus.algorithm.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Quartiles Tests")
class QuartilesTest {

  @Test
  @DisplayName("should interpolate linearly between order statistics")
  void shouldInterpolateLinearly() {
    Quartiles quartiles = Quartiles.of(new double[] {4.0, 1.0, 3.0, 2.0});

    assertThat(quartiles.q1()).isCloseTo(1.75, within(1e-12));
    assertThat(quartiles.median()).isCloseTo(2.5, within(1e-12));
    assertThat(quartiles.q3()).isCloseTo(3.25, within(1e-12));
    assertThat(quartiles.interquartileRange()).isCloseTo(1.5, within(1e-12));
  }

  @Test
  @DisplayName("should return the value itself for a single element")
  void shouldHandleSingleValue() {
    Quartiles quartiles = Quartiles.of(new double[] {7.0});

    assertThat(quartiles.q1()).isEqualTo(7.0);
    assertThat(quartiles.median()).isEqualTo(7.0);
    assertThat(quartiles.q3()).isEqualTo(7.0);
  }

  @Test
  @DisplayName("should return NaN quartiles for empty input")
  void shouldReturnNaNForEmptyInput() {
    Quartiles quartiles = Quartiles.of(new double[0]);

    assertThat(quartiles.q1()).isNaN();
    assertThat(quartiles.median()).isNaN();
    assertThat(quartiles.q3()).isNaN();
  }
}
