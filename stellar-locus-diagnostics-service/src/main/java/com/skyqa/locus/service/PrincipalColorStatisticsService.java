package com.skyqa.locus.service;

import com.skyqa.locus.algorithm.util.Masks;
import com.skyqa.locus.catalog.CatalogColumns;
import com.skyqa.locus.catalog.StarSelector;
import com.skyqa.locus.color.ColorCombiner;
import com.skyqa.locus.color.ColorTransformCatalog;
import com.skyqa.locus.color.PrincipalColorRangeSelector;
import com.skyqa.locus.config.DiagnosticsProperties;
import com.skyqa.locus.dto.ClippedStatistics;
import com.skyqa.locus.dto.ColorTransform;
import com.skyqa.locus.dto.DiagnosticCondition;
import com.skyqa.locus.dto.EnforcementResult;
import com.skyqa.locus.dto.PrincipalColorReport;
import com.skyqa.locus.dto.ScalarSample;
import com.skyqa.locus.dto.StatisticsThresholds;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Summarises the wired colors of the configured transform set over the selected stars.
 *
 * <p>Magnitudes are combined into every color whose bands are all supplied. A perpendicular
 * principal color is then restricted to its locus segment: between its bounding lines in its own
 * three-band color plane when it has them, otherwise by the ranges its parallel color must fall
 * in. The scatter of a range-limited color is held to the same limit as the locus distances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrincipalColorStatisticsService {

    private final StarSelector starSelector;
    private final ColorCombiner colorCombiner;
    private final ColorTransformCatalog colorTransformCatalog;
    private final PrincipalColorRangeSelector rangeSelector;
    private final QuantityStatisticsService quantityStatisticsService;
    private final StatisticsEnforcer statisticsEnforcer;
    private final DiagnosticsProperties properties;

    /**
     * @return one report per plotted color that could be computed, in catalog order
     * @throws com.skyqa.locus.exception.StatisticsThresholdException if a color's scatter is too
     *     large and violations are configured to be fatal
     */
    public List<PrincipalColorReport> analyse(Map<String, CatalogColumns> catalogsByBand) {
        Map<String, double[]> mags = starSelector.magnitudes(catalogsByBand);
        boolean[] stars = starSelector.selectStars(catalogsByBand, mags);
        Map<String, ColorTransform> transforms =
                colorTransformCatalog.transforms(properties.transformSet());
        Map<String, double[]> colors = colorCombiner.combineAll(transforms, mags);
        double[] referenceMags = mags.get(properties.referenceBand());

        List<PrincipalColorReport> reports = new ArrayList<>();
        for (ColorTransform transform : transforms.values()) {
            if (!transform.plot()) {
                continue;
            }
            if (!colors.containsKey(transform.name())) {
                log.debug(
                        "Skipping color {}: bands {} not all in the catalog set",
                        transform.name(),
                        transform.bands());
                continue;
            }
            double[] values = inRange(transform, colors, mags);
            reports.add(summarise(transform, values, referenceMags, stars));
        }
        log.info(
                "Summarised {} {} colors over {} stars",
                reports.size(),
                properties.transformSet(),
                Masks.count(stars));
        return reports;
    }

    private double[] inRange(
            ColorTransform transform, Map<String, double[]> colors, Map<String, double[]> mags) {
        double unitScale = properties.unitScale();
        List<String> plane = new ArrayList<>(transform.bands());
        if (transform.hasFitLines() && plane.size() == 3) {
            double[] xColor =
                    colorCombiner.difference(mags.get(plane.get(0)), mags.get(plane.get(1)));
            double[] yColor =
                    colorCombiner.difference(mags.get(plane.get(1)), mags.get(plane.get(2)));
            return rangeSelector.inFitRange(
                    transform, colors.get(transform.name()), xColor, yColor, unitScale);
        }
        if (hasRangeLimits(transform)) {
            return rangeSelector.inPerpendicularRange(transform, colors, unitScale);
        }
        double[] values = colors.get(transform.name()).clone();
        for (int i = 0; i < values.length; i++) {
            values[i] *= unitScale;
        }
        return values;
    }

    private PrincipalColorReport summarise(
            ColorTransform transform, double[] values, double[] referenceMags, boolean[] stars) {
        String description = transform.name() + transform.subDescription();
        ClippedStatistics stats =
                quantityStatisticsService.computeStatistics(
                        new ScalarSample(values, referenceMags, null, stars), null);

        List<DiagnosticCondition> conditions = new ArrayList<>();
        EnforcementResult enforcement = EnforcementResult.passed();
        if (stats.isEmpty()) {
            log.warn(
                    "{}: no stars in range for color {}",
                    DiagnosticCondition.DEGENERATE_SAMPLE,
                    description);
            conditions.add(DiagnosticCondition.DEGENERATE_SAMPLE);
        } else if (hasRangeLimits(transform)) {
            enforcement =
                    statisticsEnforcer.enforce(
                            Map.of(LocusDiagnosticsService.STAR_LABEL, stats),
                            StatisticsThresholds.lessThan(
                                    LocusDiagnosticsService.STAR_LABEL,
                                    "stdev",
                                    properties.maxDistanceStdev() * properties.unitScale()),
                            transform.name(),
                            description,
                            properties.failOnViolation());
        }
        log.info(
                "Color {}: {} of {} stars, stdev {} {}",
                description,
                stats.numUsed(),
                stats.total(),
                stats.stdev(),
                properties.units());
        return new PrincipalColorReport(
                transform.name(),
                description,
                values,
                stats,
                enforcement,
                conditions,
                properties.units());
    }

    private static boolean hasRangeLimits(ColorTransform transform) {
        return !transform.requireGreater().isEmpty() || !transform.requireLess().isEmpty();
    }
}
