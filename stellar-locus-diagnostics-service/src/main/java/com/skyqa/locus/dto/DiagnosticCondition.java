package com.skyqa.locus.dto;

/** Non-fatal conditions recorded alongside a result that still carries NaN sentinels. */
public enum DiagnosticCondition {
  /** No usable points were left to summarise. */
  DEGENERATE_SAMPLE,
  /** An iterative solver ran out of budget or could not bracket its root. */
  SOLVER_NON_CONVERGENCE
}
