package com.skyqa.locus.service;

import com.skyqa.locus.dto.ClippedStatistics;
import com.skyqa.locus.dto.EnforcementResult;
import com.skyqa.locus.dto.StatisticsThresholds;
import com.skyqa.locus.exception.StatisticsThresholdException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compares labelled statistics against configured limits.
 *
 * <p>A statistic violates a {@code requireGreater} limit when it is not strictly greater than it,
 * and a {@code requireLess} limit when it is not strictly less. NaN never passes a limit. Each
 * violation is logged as a warning; labels absent from the statistics are skipped.
 */
@Service
@Slf4j
public class StatisticsEnforcer {

    private static final String MINIMUM_FORMAT = "%s %s = %f exceeds minimum limit of %f: %s";
    private static final String MAXIMUM_FORMAT = "%s %s = %f exceeds maximum limit of %f: %s";

    /**
     * @param statsByLabel statistics per label, e.g. {@code star}
     * @param dataId identifier of the data being checked, appended to each message
     * @param description what the statistics describe, prefixed to each message
     * @param failOnViolation throw instead of returning when anything is violated
     * @throws StatisticsThresholdException if {@code failOnViolation} is set and a limit is broken
     * @throws IllegalArgumentException if a limit names an unknown statistic
     */
    public EnforcementResult enforce(
            Map<String, ClippedStatistics> statsByLabel,
            StatisticsThresholds thresholds,
            String dataId,
            String description,
            boolean failOnViolation) {
        List<String> violations = new ArrayList<>();
        check(statsByLabel, thresholds.requireGreater(), dataId, description, true, violations);
        check(statsByLabel, thresholds.requireLess(), dataId, description, false, violations);

        if (violations.isEmpty()) {
            log.debug("All statistics within limits for {}", description);
            return EnforcementResult.passed();
        }
        if (failOnViolation) {
            throw new StatisticsThresholdException(
                    violations.size()
                            + " statistic(s) outside limits: "
                            + String.join("; ", violations),
                    violations);
        }
        return new EnforcementResult(violations);
    }

    private static void check(
            Map<String, ClippedStatistics> statsByLabel,
            Map<String, Map<String, Double>> limitsByLabel,
            String dataId,
            String description,
            boolean minimum,
            List<String> violations) {
        for (Map.Entry<String, Map<String, Double>> labelLimits : limitsByLabel.entrySet()) {
            ClippedStatistics stats = statsByLabel.get(labelLimits.getKey());
            if (stats == null) {
                log.debug("No statistics for label {}, skipping its limits", labelLimits.getKey());
                continue;
            }
            for (Map.Entry<String, Double> limit : labelLimits.getValue().entrySet()) {
                double value = stats.statistic(limit.getKey());
                double bound = limit.getValue();
                boolean passed = minimum ? value > bound : value < bound;
                if (!passed) {
                    String message =
                            String.format(
                                    Locale.ROOT,
                                    minimum ? MINIMUM_FORMAT : MAXIMUM_FORMAT,
                                    description,
                                    limit.getKey(),
                                    value,
                                    bound,
                                    dataId);
                    log.warn(message);
                    violations.add(message);
                }
            }
        }
    }
}
