package com.skyqa.locus.service;

import com.skyqa.locus.algorithm.fit.OrthogonalRegressionFitter;
import com.skyqa.locus.algorithm.fit.PolynomialLocusFitter;
import com.skyqa.locus.dto.FitRegion;
import com.skyqa.locus.dto.LocusFitRequest;
import com.skyqa.locus.dto.LocusFitResult;
import com.skyqa.locus.dto.LocusFitStrategy;
import com.skyqa.locus.dto.PolynomialModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fits a polynomial to a stellar locus: an iteratively clipped ordinary least-squares seed followed
 * by orthogonal-distance refinement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocusFitService {

    private final PolynomialLocusFitter polynomialLocusFitter;
    private final OrthogonalRegressionFitter orthogonalRegressionFitter;

    /**
     * @param region fit region, or null for none
     * @param strategy how the fit is seeded; null means {@link LocusFitStrategy#STANDARD}
     * @param initialGuess seed for a near-vertical locus, or null to seed from the region's x range
     * @throws com.skyqa.locus.exception.InsufficientDataException if too few points survive
     * @throws com.skyqa.locus.exception.InvalidRegionException if a vertical fit has no x range
     */
    public LocusFitResult fitStellarLocus(
            double[] x,
            double[] y,
            int degree,
            FitRegion region,
            double rejectionFactor,
            int iterations,
            LocusFitStrategy strategy,
            PolynomialModel initialGuess) {
        return fitStellarLocus(
                new LocusFitRequest(
                        x, y, degree, region, rejectionFactor, iterations, strategy, initialGuess));
    }

    public LocusFitResult fitStellarLocus(LocusFitRequest request) {
        log.debug(
                "Fitting degree {} {} locus to {} points",
                request.degree(),
                request.strategy(),
                request.size());
        PolynomialLocusFitter.SeedFit seed = polynomialLocusFitter.fitSeed(request);
        LocusFitResult result = orthogonalRegressionFitter.refine(request, seed);
        log.info(
                "Locus fit {} kept {} of {} points",
                result.model(),
                result.keptCount(),
                request.size());
        return result;
    }
}
