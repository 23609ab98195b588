package com.skyqa.locus.color;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.skyqa.locus.color.ColorTransformCatalog.TransformSet;
import com.skyqa.locus.dto.ColorTransform;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Principal Color Range Selector Tests")
class PrincipalColorRangeSelectorTest {

  private final PrincipalColorRangeSelector selector = new PrincipalColorRangeSelector();
  private final ColorTransformCatalog catalog = new ColorTransformCatalog();

  @Test
  @DisplayName("should keep stars between the bounding lines and scale them")
  void shouldSelectBetweenFitLines() {
    ColorTransform wPerp = catalog.get(TransformSet.HSC, "wPerp");
    double[] wPerpValues = {0.01, 0.02, -0.03};
    double[] gr = {0.5, 0.5, 0.5};
    double[] ri = {0.2, 2.0, -1.0};

    double[] selected = selector.inFitRange(wPerp, wPerpValues, gr, ri, 1000.0);

    assertThat(selected[0]).isCloseTo(10.0, within(1e-9));
    assertThat(selected[1]).isNaN();
    assertThat(selected[2]).isNaN();
  }

  @Test
  @DisplayName("should fail for a transform without bounding lines")
  void shouldRejectTransformWithoutLines() {
    ColorTransform sdss = catalog.get(TransformSet.SDSS, "wPerp");

    assertThatThrownBy(
            () -> selector.inFitRange(sdss, new double[1], new double[1], new double[1], 1.0))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should apply the parallel color limits strictly")
  void shouldSelectInPerpendicularRange() {
    ColorTransform wPerp = catalog.get(TransformSet.HSC, "wPerp");
    Map<String, double[]> colors =
        Map.of(
            "wPerp", new double[] {0.01, 0.02, 0.03, 0.04},
            "wPara", new double[] {0.0, -0.2, 0.6, 0.59});

    double[] selected = selector.inPerpendicularRange(wPerp, colors, 1.0);

    assertThat(selected[0]).isEqualTo(0.01);
    assertThat(selected[1]).isNaN();
    assertThat(selected[2]).isNaN();
    assertThat(selected[3]).isEqualTo(0.04);
  }

  @Test
  @DisplayName("should fail when a limiting color is not supplied")
  void shouldRejectMissingLimitColor() {
    ColorTransform wPerp = catalog.get(TransformSet.HSC, "wPerp");

    assertThatThrownBy(
            () -> selector.inPerpendicularRange(wPerp, Map.of("wPerp", new double[1]), 1.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("wPara");
  }
}
