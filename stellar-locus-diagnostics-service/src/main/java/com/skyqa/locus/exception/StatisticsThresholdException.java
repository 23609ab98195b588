package com.skyqa.locus.exception;

import java.util.List;

/** Thrown by the statistics enforcer when violations are configured to be fatal. */
public class StatisticsThresholdException extends LocusDiagnosticsException {

    private final List<String> violations;

    public StatisticsThresholdException(String message, List<String> violations) {
        super(message);
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public StatisticsThresholdException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<String> getViolations() {
        return violations;
    }
}
