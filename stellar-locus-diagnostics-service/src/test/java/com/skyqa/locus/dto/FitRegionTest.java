package com.skyqa.locus.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.skyqa.locus.exception.InvalidRegionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Fit Region Tests")
class FitRegionTest {

  private final FitRegion region =
      FitRegion.builder()
          .xRange(FitRegion.Range.of(0.0, 1.0))
          .yRange(FitRegion.Range.of(0.0, 2.0))
          .upperLine(FitLine.of(1.5, 0.0))
          .lowerLine(FitLine.of(0.2, 0.0))
          .build();

  @Nested
  @DisplayName("Membership")
  class MembershipTests {

    @Test
    @DisplayName("should contain a point strictly inside every bound")
    void shouldContainInteriorPoint() {
      assertThat(region.contains(0.5, 1.0)).isTrue();
    }

    @Test
    @DisplayName("should exclude points on the range edges")
    void shouldExcludeRangeEdges() {
      assertThat(region.contains(0.0, 1.0)).isFalse();
      assertThat(region.contains(1.0, 1.0)).isFalse();
    }

    @Test
    @DisplayName("should exclude points outside the bounding lines")
    void shouldExcludeOutsideLines() {
      assertThat(region.contains(0.5, 1.6)).isFalse();
      assertThat(region.contains(0.5, 0.1)).isFalse();
      assertThat(region.contains(0.5, 1.5)).isFalse();
    }

    @Test
    @DisplayName("should exclude non-finite coordinates even when unbounded")
    void shouldExcludeNonFinite() {
      assertThat(FitRegion.unbounded().contains(Double.NaN, 0.0)).isFalse();
      assertThat(FitRegion.unbounded().contains(0.0, Double.POSITIVE_INFINITY)).isFalse();
      assertThat(FitRegion.unbounded().contains(-1e6, 1e6)).isTrue();
    }
  }

  @Nested
  @DisplayName("Padding")
  class PaddingTests {

    @Test
    @DisplayName("should widen both ranges by seven percent of their span")
    void shouldPadRanges() {
      FitRegion padded = region.padded();

      assertThat(padded.xRange().min()).isCloseTo(-0.07, within(1e-12));
      assertThat(padded.xRange().max()).isCloseTo(1.07, within(1e-12));
      assertThat(padded.yRange().min()).isCloseTo(-0.14, within(1e-12));
      assertThat(padded.yRange().max()).isCloseTo(2.14, within(1e-12));
      assertThat(padded.upperLine()).isEqualTo(region.upperLine());
      assertThat(padded.contains(1.05, 1.0)).isTrue();
    }

    @Test
    @DisplayName("should leave an unbounded region unbounded")
    void shouldPadUnbounded() {
      assertThat(FitRegion.unbounded().padded()).isEqualTo(FitRegion.unbounded());
    }
  }

  @Nested
  @DisplayName("Validation")
  class ValidationTests {

    @Test
    @DisplayName("should reject a range with min not below max")
    void shouldRejectInvertedRange() {
      assertThatThrownBy(() -> FitRegion.Range.of(1.0, 1.0))
          .isInstanceOf(InvalidRegionException.class);
      assertThatThrownBy(() -> FitRegion.Range.of(2.0, 1.0))
          .isInstanceOf(InvalidRegionException.class);
    }

    @Test
    @DisplayName("should reject non-finite bounds and malformed arrays")
    void shouldRejectNonFinite() {
      assertThatThrownBy(() -> FitRegion.Range.of(Double.NaN, 1.0))
          .isInstanceOf(InvalidRegionException.class);
      assertThatThrownBy(() -> FitRegion.Range.of(new double[] {1.0}))
          .isInstanceOf(InvalidRegionException.class);
      assertThatThrownBy(() -> FitLine.of(Double.POSITIVE_INFINITY, 1.0))
          .isInstanceOf(InvalidRegionException.class);
      assertThatThrownBy(() -> FitLine.fromPair(new double[] {1.0, 2.0, 3.0}))
          .isInstanceOf(InvalidRegionException.class);
    }
  }
}
