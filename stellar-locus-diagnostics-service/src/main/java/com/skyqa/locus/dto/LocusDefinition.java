package com.skyqa.locus.dto;

/**
 * One stellar locus to diagnose, in the plane x = band1 − band2, y = band2 − band3.
 *
 * @param initialGuess seed polynomial for a near-vertical fit, or null
 */
public record LocusDefinition(
    String name,
    String band1,
    String band2,
    String band3,
    int degree,
    FitRegion region,
    LocusFitStrategy strategy,
    PolynomialModel initialGuess) {

  public LocusDefinition {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Locus name is required");
    }
    if (band1 == null || band2 == null || band3 == null) {
      throw new IllegalArgumentException("Locus " + name + " needs three bands");
    }
    if (degree < 1) {
      throw new IllegalArgumentException("Locus " + name + " needs a degree of at least 1");
    }
    region = region == null ? FitRegion.unbounded() : region;
    strategy = strategy == null ? LocusFitStrategy.STANDARD : strategy;
  }
}
