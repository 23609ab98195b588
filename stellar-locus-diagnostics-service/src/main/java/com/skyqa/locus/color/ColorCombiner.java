package com.skyqa.locus.color;

import com.skyqa.locus.dto.ColorTransform;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Turns per-band magnitude arrays into colors. */
@Component
public class ColorCombiner {

  /**
   * Evaluates {@code constant + Σ coeff·mag(band)} for every object.
   *
   * @param magnitudesByBand one magnitude array per band, all of equal length
   * @throws IllegalArgumentException if a band the transform needs is missing or lengths differ
   */
  public double[] combine(ColorTransform transform, Map<String, double[]> magnitudesByBand) {
    int n = commonLength(magnitudesByBand);
    double[] color = new double[n];
    Arrays.fill(color, transform.constant());
    for (Map.Entry<String, Double> term : transform.coefficients().entrySet()) {
      double[] mags = magnitudesByBand.get(term.getKey());
      if (mags == null) {
        throw new IllegalArgumentException(
            "Color " + transform.name() + " needs band " + term.getKey() + ", which is missing");
      }
      double coeff = term.getValue();
      for (int i = 0; i < n; i++) {
        color[i] += coeff * mags[i];
      }
    }
    return color;
  }

  /** Applies every transform whose bands are all available, keyed by transform name. */
  public Map<String, double[]> combineAll(
      Map<String, ColorTransform> transforms, Map<String, double[]> magnitudesByBand) {
    Map<String, double[]> colors = new LinkedHashMap<>();
    transforms.forEach(
        (name, transform) -> {
          if (magnitudesByBand.keySet().containsAll(transform.bands())) {
            colors.put(name, combine(transform, magnitudesByBand));
          }
        });
    return colors;
  }

  /** {@code band1 − band2}. */
  public double[] difference(double[] band1, double[] band2) {
    if (band1.length != band2.length) {
      throw new IllegalArgumentException(
          "Band arrays must have equal lengths: " + band1.length + " vs " + band2.length);
    }
    double[] out = new double[band1.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = band1[i] - band2[i];
    }
    return out;
  }

  private static int commonLength(Map<String, double[]> magnitudesByBand) {
    int n = -1;
    for (Map.Entry<String, double[]> entry : magnitudesByBand.entrySet()) {
      if (n < 0) {
        n = entry.getValue().length;
      } else if (entry.getValue().length != n) {
        throw new IllegalArgumentException(
            String.format(
                "Band %s has %d objects, expected %d",
                entry.getKey(), entry.getValue().length, n));
      }
    }
    return Math.max(n, 0);
  }
}
