package com.skyqa.locus.dto;

import java.util.List;

/** Threshold violations found by the statistics enforcer; empty when everything passed. */
public record EnforcementResult(List<String> violations) {

  private static final EnforcementResult PASSED = new EnforcementResult(List.of());

  public EnforcementResult {
    violations = violations == null ? List.of() : List.copyOf(violations);
  }

  public static EnforcementResult passed() {
    return PASSED;
  }

  public boolean isPassed() {
    return violations.isEmpty();
  }
}
