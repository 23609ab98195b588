package com.skyqa.locus.color;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.skyqa.locus.dto.ColorTransform;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Color Combiner Tests")
class ColorCombinerTest {

  private final ColorCombiner combiner = new ColorCombiner();

  private final Map<String, double[]> mags =
      Map.of(
          "HSC-G", new double[] {20.0, 21.0},
          "HSC-R", new double[] {19.5, 20.0},
          "HSC-I", new double[] {19.3, 19.6});

  @Test
  @DisplayName("should add the constant to the weighted band sum")
  void shouldCombineBands() {
    ColorTransform wPerp =
        new ColorTransformCatalog().get(ColorTransformCatalog.TransformSet.HSC, "wPerp");

    double[] color = combiner.combine(wPerp, mags);

    double expected = 0.036 - 0.272 * 20.0 + 0.803 * 19.5 - 0.531 * 19.3;
    assertThat(color[0]).isCloseTo(expected, within(1e-12));
  }

  @Test
  @DisplayName("should compute a plain band difference")
  void shouldComputeDifference() {
    double[] gr = combiner.combine(ColorTransform.difference("g-r", "HSC-G", "HSC-R"), mags);

    assertThat(gr).containsExactly(new double[] {0.5, 1.0}, within(1e-12));
  }

  @Test
  @DisplayName("should fail when a needed band is missing")
  void shouldRejectMissingBand() {
    ColorTransform iz = ColorTransform.difference("i-z", "HSC-I", "HSC-Z");

    assertThatThrownBy(() -> combiner.combine(iz, mags))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("HSC-Z");
  }

  @Test
  @DisplayName("should skip transforms whose bands are not all present")
  void shouldSkipIncompleteTransforms() {
    Map<String, double[]> colors =
        combiner.combineAll(
            new ColorTransformCatalog().transforms(ColorTransformCatalog.TransformSet.HSC), mags);

    assertThat(colors).containsKeys("wPerp", "xPerp", "wPara", "wFit").doesNotContainKey("yPerp");
  }

  @Test
  @DisplayName("should reject arrays of different lengths")
  void shouldRejectMismatchedLengths() {
    assertThatThrownBy(() -> combiner.difference(new double[2], new double[3]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
