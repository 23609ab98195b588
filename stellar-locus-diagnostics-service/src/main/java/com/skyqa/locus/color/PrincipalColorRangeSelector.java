package com.skyqa.locus.color;

import com.skyqa.locus.dto.ColorTransform;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Masks a principal color to the stars that belong to its locus segment.
 *
 * <p>Two selections are offered. The fit-range one keeps stars between the transform's two
 * bounding lines in the color-color plane it was derived in. The perpendicular-range one keeps
 * stars whose other principal colors satisfy the transform's {@code requireGreater} and
 * {@code requireLess} limits. Everything else becomes NaN, and kept values are multiplied by the
 * unit scale.
 */
@Component
public class PrincipalColorRangeSelector {

  /**
   * @param principalColor values of the principal color for every object
   * @param xColor x coordinate of the color-color plane, e.g. g − r
   * @param yColor y coordinate of the color-color plane, e.g. r − i
   * @throws IllegalStateException if the transform has no bounding lines
   */
  public double[] inFitRange(
      ColorTransform transform,
      double[] principalColor,
      double[] xColor,
      double[] yColor,
      double unitScale) {
    double lowerIntercept = transform.lowerFitLine().intercept();
    double upperIntercept = transform.upperFitLine().intercept();
    double slope = transform.fitLineSlope();
    double[] out = new double[principalColor.length];
    for (int i = 0; i < out.length; i++) {
      boolean good =
          yColor[i] > lowerIntercept + slope * xColor[i]
              && yColor[i] < upperIntercept + slope * xColor[i];
      out[i] = good ? principalColor[i] * unitScale : Double.NaN;
    }
    return out;
  }

  /**
   * @param colorsByName every principal color the limits may refer to
   * @throws IllegalArgumentException if a limit names a color that is not supplied
   */
  public double[] inPerpendicularRange(
      ColorTransform transform, Map<String, double[]> colorsByName, double unitScale) {
    double[] principalColor = require(colorsByName, transform.name());
    double[] out = new double[principalColor.length];
    for (int i = 0; i < out.length; i++) {
      boolean good = true;
      for (Map.Entry<String, Double> limit : transform.requireGreater().entrySet()) {
        good &= require(colorsByName, limit.getKey())[i] > limit.getValue();
      }
      for (Map.Entry<String, Double> limit : transform.requireLess().entrySet()) {
        good &= require(colorsByName, limit.getKey())[i] < limit.getValue();
      }
      out[i] = good ? principalColor[i] * unitScale : Double.NaN;
    }
    return out;
  }

  private static double[] require(Map<String, double[]> colorsByName, String name) {
    double[] values = colorsByName.get(name);
    if (values == null) {
      throw new IllegalArgumentException("Color " + name + " is not available");
    }
    return values;
  }
}
