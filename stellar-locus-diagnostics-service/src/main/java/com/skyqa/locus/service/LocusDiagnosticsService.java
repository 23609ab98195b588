package com.skyqa.locus.service;

import com.skyqa.locus.algorithm.RobustStatisticsCalculator;
import com.skyqa.locus.algorithm.distance.CurveDistanceEvaluator;
import com.skyqa.locus.algorithm.fit.FitLineConsistencyChecker;
import com.skyqa.locus.catalog.CatalogColumns;
import com.skyqa.locus.catalog.StarSelector;
import com.skyqa.locus.color.ColorCombiner;
import com.skyqa.locus.color.PrincipalColorDeriver;
import com.skyqa.locus.config.DiagnosticsProperties;
import com.skyqa.locus.dto.ClippedStatistics;
import com.skyqa.locus.dto.DiagnosticCondition;
import com.skyqa.locus.dto.EnforcementResult;
import com.skyqa.locus.dto.LocusDefinition;
import com.skyqa.locus.dto.LocusDiagnosticsReport;
import com.skyqa.locus.dto.LocusFitRequest;
import com.skyqa.locus.dto.LocusFitResult;
import com.skyqa.locus.dto.PrincipalColorCoefficients;
import com.skyqa.locus.dto.ScalarSample;
import com.skyqa.locus.dto.StatisticsThresholds;
import com.skyqa.locus.exception.InsufficientDataException;
import com.skyqa.locus.exception.InvalidRegionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the stellar-locus diagnostic for one or all configured loci.
 *
 * <p>For a locus in the plane x = band1 − band2, y = band2 − band3:
 *
 * <ol>
 *   <li>flux columns become magnitudes and clean bright stars are selected,
 *   <li>the locus polynomial is fitted to the selected stars inside the fit region,
 *   <li>configured bounding lines are checked against the fit,
 *   <li>a straight-line fit yields principal-color coefficients,
 *   <li>every selected star between the bounding lines gets its signed distance to the fit,
 *   <li>the distances are summarised and their scatter checked against the configured limit.
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocusDiagnosticsService {

    static final String STAR_LABEL = "star";

    private final StarSelector starSelector;
    private final ColorCombiner colorCombiner;
    private final LocusFitService locusFitService;
    private final FitLineConsistencyChecker fitLineConsistencyChecker;
    private final PrincipalColorDeriver principalColorDeriver;
    private final CurveDistanceEvaluator curveDistanceEvaluator;
    private final RobustStatisticsCalculator statisticsCalculator;
    private final StatisticsEnforcer statisticsEnforcer;
    private final DiagnosticsProperties properties;

    /**
     * Every configured locus. Loci whose bands are not all supplied, or that cannot be fitted, are
     * logged and left out.
     */
    public List<LocusDiagnosticsReport> analyseAll(Map<String, CatalogColumns> catalogsByBand) {
        List<LocusDiagnosticsReport> reports = new ArrayList<>();
        for (LocusDefinition locus : properties.locusDefinitions()) {
            List<String> bands = List.of(locus.band1(), locus.band2(), locus.band3());
            if (!catalogsByBand.keySet().containsAll(bands)) {
                log.warn(
                        "Skipping locus {}: bands {} are not all in the catalog set {}",
                        locus.name(),
                        bands,
                        catalogsByBand.keySet());
                continue;
            }
            try {
                reports.add(analyse(catalogsByBand, locus));
            } catch (InsufficientDataException | InvalidRegionException e) {
                log.warn("Skipping locus {}: {}", locus.name(), e.getMessage());
            }
        }
        log.info("Analysed {} of {} loci", reports.size(), properties.locusDefinitions().size());
        return reports;
    }

    /**
     * @throws IllegalArgumentException if a band of the locus is not in {@code catalogsByBand}
     * @throws InsufficientDataException if too few stars are left to fit
     * @throws InvalidRegionException if the locus region cannot seed its fit
     * @throws com.skyqa.locus.exception.StatisticsThresholdException if the distance scatter is too
     *     large and violations are configured to be fatal
     */
    public LocusDiagnosticsReport analyse(
            Map<String, CatalogColumns> catalogsByBand, LocusDefinition locus) {
        Map<String, double[]> mags = starSelector.magnitudes(catalogsByBand);
        boolean[] stars = starSelector.selectStars(catalogsByBand, mags);

        double[] x = colorCombiner.difference(band(mags, locus.band1()), band(mags, locus.band2()));
        double[] y = colorCombiner.difference(band(mags, locus.band2()), band(mags, locus.band3()));
        for (int i = 0; i < x.length; i++) {
            if (!stars[i]) {
                x[i] = Double.NaN;
                y[i] = Double.NaN;
            }
        }

        LocusFitResult fit =
                locusFitService.fitStellarLocus(
                        new LocusFitRequest(
                                x,
                                y,
                                locus.degree(),
                                locus.region(),
                                properties.rejectionFactor(),
                                properties.iterations(),
                                locus.strategy(),
                                locus.initialGuess()));

        List<String> fitLineWarnings =
                locus.region().hasBoundingLines()
                        ? fitLineConsistencyChecker.check(fit.model(), locus.region())
                        : List.of();

        PrincipalColorCoefficients principalColors = null;
        if (locus.degree() == 1) {
            double[] densest =
                    principalColorDeriver.highestDensityPoint(
                            x,
                            y,
                            fit.keepMask(),
                            PrincipalColorDeriver.DEFAULT_DENSITY_RADIUS_FRACTION);
            principalColors =
                    principalColorDeriver.derive(
                            locus.band1(),
                            locus.band2(),
                            locus.band3(),
                            fit.model(),
                            densest[0],
                            densest[1]);
        }

        double unitScale = properties.unitScale();
        double[] distances =
                curveDistanceEvaluator.evaluateCurveDistance(
                        x, y, fit.model(), locus.region(), unitScale);
        ClippedStatistics distanceStats =
                statisticsCalculator.computeRobustStatistics(
                        ScalarSample.of(distances), properties.clipFactor(), null);

        List<DiagnosticCondition> conditions = new ArrayList<>();
        EnforcementResult enforcement;
        if (distanceStats.isEmpty()) {
            log.warn(
                    "{}: no distances to summarise for locus {}",
                    DiagnosticCondition.DEGENERATE_SAMPLE,
                    locus.name());
            conditions.add(DiagnosticCondition.DEGENERATE_SAMPLE);
            enforcement = EnforcementResult.passed();
        } else {
            enforcement =
                    statisticsEnforcer.enforce(
                            Map.of(STAR_LABEL, distanceStats),
                            StatisticsThresholds.lessThan(
                                    STAR_LABEL, "stdev", properties.maxDistanceStdev() * unitScale),
                            locus.name(),
                            "Distance to " + locus.name() + " locus",
                            properties.failOnViolation());
        }

        log.info(
                "Locus {}: {} of {} stars, distance stdev {} {}",
                locus.name(),
                distanceStats.numUsed(),
                distanceStats.total(),
                distanceStats.stdev(),
                properties.units());
        return new LocusDiagnosticsReport(
                locus.name(),
                fit,
                distances,
                distanceStats,
                enforcement,
                principalColors,
                fitLineWarnings,
                conditions,
                properties.units());
    }

    private static double[] band(Map<String, double[]> mags, String band) {
        double[] values = mags.get(band);
        if (values == null) {
            throw new IllegalArgumentException("Band " + band + " is not in the catalog set");
        }
        return values;
    }
}
