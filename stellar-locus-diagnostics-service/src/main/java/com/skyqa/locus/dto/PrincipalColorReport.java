package com.skyqa.locus.dto;

import java.util.List;

/**
 * Clipped summary of one wired color over the selected stars.
 *
 * @param values per-object color in {@code units}, NaN for objects outside the color's range
 * @param enforcement outcome of the scatter limit; always passed for colors without range limits
 */
public record PrincipalColorReport(
    String colorName,
    String description,
    double[] values,
    ClippedStatistics statistics,
    EnforcementResult enforcement,
    List<DiagnosticCondition> conditions,
    String units) {

  public PrincipalColorReport {
    values = values.clone();
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  @Override
  public double[] values() {
    return values.clone();
  }

  public boolean isClean() {
    return conditions.isEmpty() && enforcement.isPassed();
  }
}
