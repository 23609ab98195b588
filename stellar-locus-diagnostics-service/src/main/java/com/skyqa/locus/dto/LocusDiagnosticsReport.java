package com.skyqa.locus.dto;

import java.util.List;

/**
 * Everything computed for one locus: the fit, the signed distance of every selected star to it,
 * the clipped summary of those distances and the enforcement outcome.
 *
 * @param distances per-object distances in {@code units}, NaN for objects outside the selection
 * @param principalColors principal colors derived from a straight-line fit, or null for a curve
 * @param fitLineWarnings bounding lines that no longer cut the fit at right angles
 */
public record LocusDiagnosticsReport(
    String locusName,
    LocusFitResult fit,
    double[] distances,
    ClippedStatistics distanceStatistics,
    EnforcementResult enforcement,
    PrincipalColorCoefficients principalColors,
    List<String> fitLineWarnings,
    List<DiagnosticCondition> conditions,
    String units) {

  public LocusDiagnosticsReport {
    distances = distances.clone();
    fitLineWarnings = fitLineWarnings == null ? List.of() : List.copyOf(fitLineWarnings);
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  @Override
  public double[] distances() {
    return distances.clone();
  }

  public boolean isClean() {
    return conditions.isEmpty() && enforcement.isPassed();
  }
}
