package com.skyqa.locus.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.Builder;

/**
 * Linear combination of per-band magnitudes defining a color: {@code constant + Σ coeff·mag}.
 *
 * <p>Principal-color transforms also carry the locus origin {@code (x0, y0)} in the plane they were
 * derived in, the ranges other colors must satisfy for an object to count
 * ({@code requireGreater} / {@code requireLess}, keyed by color name), and the perpendicular line
 * parameters used to select objects along the locus.
 */
@Builder
public record ColorTransform(
    String name,
    String description,
    String subDescription,
    boolean plot,
    Map<String, Double> coefficients,
    double constant,
    Double x0,
    Double y0,
    Map<String, Double> requireGreater,
    Map<String, Double> requireLess,
    Double fitLineSlope,
    Double fitLineUpperIntercept,
    Double fitLineLowerIntercept) {

  public ColorTransform {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Color transform name is required");
    }
    if (coefficients == null || coefficients.isEmpty()) {
      throw new IllegalArgumentException("Color transform " + name + " has no band coefficients");
    }
    coefficients = frozen(coefficients);
    requireGreater = frozen(requireGreater);
    requireLess = frozen(requireLess);
    description = description == null ? name : description;
    subDescription = subDescription == null ? "" : subDescription;
  }

  /** Plain {@code band1 − band2} color. */
  public static ColorTransform difference(String name, String band1, String band2) {
    Map<String, Double> coeffs = new LinkedHashMap<>();
    coeffs.put(band1, 1.0);
    coeffs.put(band2, -1.0);
    return ColorTransform.builder()
        .name(name)
        .description(band1 + " - " + band2)
        .coefficients(coeffs)
        .build();
  }

  public Set<String> bands() {
    return coefficients.keySet();
  }

  public boolean hasOrigin() {
    return x0 != null && y0 != null;
  }

  public boolean hasFitLines() {
    return fitLineSlope != null && fitLineUpperIntercept != null && fitLineLowerIntercept != null;
  }

  public FitLine upperFitLine() {
    requireFitLines();
    return FitLine.of(fitLineUpperIntercept, fitLineSlope);
  }

  public FitLine lowerFitLine() {
    requireFitLines();
    return FitLine.of(fitLineLowerIntercept, fitLineSlope);
  }

  private void requireFitLines() {
    if (!hasFitLines()) {
      throw new IllegalStateException("Color transform " + name + " has no fit lines");
    }
  }

  private static Map<String, Double> frozen(Map<String, Double> in) {
    return in == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(in));
  }
}
