package com.skyqa.locus.service;

import com.skyqa.locus.algorithm.RobustStatisticsCalculator;
import com.skyqa.locus.algorithm.SystematicErrorSolver;
import com.skyqa.locus.config.DiagnosticsProperties;
import com.skyqa.locus.dto.ClippedStatistics;
import com.skyqa.locus.dto.DiagnosticCondition;
import com.skyqa.locus.dto.ScalarSample;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Summarises a per-object quantity for each label (star, galaxy, ...) of a catalog.
 *
 * <p>Each labelled sample is restricted to objects brighter than the configured magnitude
 * threshold and summarised with the configured clip factor. Samples carrying per-object errors
 * also get the systematic error that brings their normalised scatter to one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuantityStatisticsService {

    private final RobustStatisticsCalculator statisticsCalculator;
    private final SystematicErrorSolver systematicErrorSolver;
    private final DiagnosticsProperties properties;

    /**
     * Groups objects by label and summarises each group.
     *
     * @param errors per-object errors, or null
     * @param labels per-object label, e.g. {@code star} or {@code galaxy}; null entries are ignored
     */
    public Map<String, ClippedStatistics> computeStatistics(
            double[] values,
            double[] magnitudes,
            double[] errors,
            String[] labels,
            Double forcedMean) {
        if (labels.length != values.length) {
            throw new IllegalArgumentException(
                    "Expected one label per object: " + labels.length + " vs " + values.length);
        }
        Map<String, ScalarSample> samples = new LinkedHashMap<>();
        for (String label : labels) {
            if (label == null || samples.containsKey(label)) {
                continue;
            }
            boolean[] member = new boolean[labels.length];
            for (int i = 0; i < labels.length; i++) {
                member[i] = label.equals(labels[i]);
            }
            samples.put(label, new ScalarSample(values, magnitudes, errors, member));
        }
        return computeStatistics(samples, forcedMean);
    }

    /**
     * @param samplesByLabel one sample per label; empty samples are skipped
     * @param forcedMean mean to impose on every label, or null
     * @return statistics per label in the order given; empty when nothing was usable
     */
    public Map<String, ClippedStatistics> computeStatistics(
            Map<String, ScalarSample> samplesByLabel, Double forcedMean) {
        Map<String, ClippedStatistics> stats = new LinkedHashMap<>();
        for (Map.Entry<String, ScalarSample> entry : samplesByLabel.entrySet()) {
            ScalarSample sample = entry.getValue();
            if (sample.size() == 0) {
                continue;
            }
            stats.put(entry.getKey(), computeStatistics(sample, forcedMean));
        }
        if (stats.isEmpty()) {
            log.warn("No usable data in {} labelled samples", samplesByLabel.size());
        }
        return stats;
    }

    public ClippedStatistics computeStatistics(ScalarSample sample, Double forcedMean) {
        ScalarSample bright = sample.brighterThan(properties.magThreshold());
        ClippedStatistics stats =
                statisticsCalculator.computeRobustStatistics(
                        bright, properties.clipFactor(), forcedMean);
        if (!sample.hasErrors()) {
            return stats;
        }
        double sysErr =
                systematicErrorSolver.solveSystematicError(
                        bright, properties.clipFactor(), forcedMean, properties.sysErrTolerance());
        if (Double.isNaN(sysErr) && !stats.isEmpty()) {
            log.warn(
                    "{}: no systematic error for {} objects",
                    DiagnosticCondition.SOLVER_NON_CONVERGENCE,
                    stats.total());
        }
        return stats.withSysErr(sysErr);
    }
}
