package com.skyqa.locus.config;

import com.skyqa.locus.color.ColorTransformCatalog.TransformSet;
import com.skyqa.locus.dto.FitLine;
import com.skyqa.locus.dto.FitRegion;
import com.skyqa.locus.dto.LocusDefinition;
import com.skyqa.locus.dto.LocusFitStrategy;
import com.skyqa.locus.dto.PolynomialModel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the stellar locus and statistics diagnostics.
 *
 * <p>Maps to the {@code diagnostics} section of application.yml. Clip settings feed the robust
 * statistics and the locus fit; the catalog settings decide which columns are read and which
 * objects count as clean stars; {@code loci} lists the color-color fits to run.
 */
@ConfigurationProperties(prefix = "diagnostics")
@Validated
public record DiagnosticsProperties(

    // Robust statistics
    @DecimalMin(value = "0.1", message = "Clip factor must be at least 0.1")
        @NotNull(message = "Clip factor is required")
        Double clipFactor,
    @DecimalMin(value = "0.0", inclusive = false, message = "sysErr tolerance must be positive")
        @NotNull(message = "sysErr tolerance is required")
        Double sysErrTolerance,

    // Locus fitting
    @DecimalMin(value = "0.1", message = "Rejection factor must be at least 0.1")
        @NotNull(message = "Rejection factor is required")
        Double rejectionFactor,
    @Min(value = 1, message = "At least one fit iteration is required")
        @NotNull(message = "Iterations is required")
        Integer iterations,

    // Catalog and star selection
    @NotNull(message = "Magnitude threshold is required") Double magThreshold,
    @NotNull(message = "Zero point is required") Double zeroPoint,
    @NotBlank(message = "Flux column is required") String fluxColumn,
    @NotBlank(message = "Reference band is required") String referenceBand,
    @NotBlank(message = "Classification column is required") String classificationColumn,
    @Min(value = 1, message = "Minimum star bands must be at least 1")
        @NotNull(message = "Minimum star bands is required")
        Integer minStarBands,
    List<String> badFlags,
    @NotNull(message = "Transform set is required") TransformSet transformSet,

    // Reporting and enforcement
    @NotNull(message = "toMilli flag is required") Boolean toMilli,
    @DecimalMin(value = "0.0", inclusive = false, message = "Max distance stdev must be positive")
        @NotNull(message = "Max distance stdev is required")
        Double maxDistanceStdev,
    @NotNull(message = "failOnViolation flag is required") Boolean failOnViolation,
    @Valid List<LocusProperties> loci) {

  public DiagnosticsProperties {
    badFlags = badFlags == null ? List.of() : List.copyOf(badFlags);
    loci = loci == null ? List.of() : List.copyOf(loci);
  }

  /** 1000 when results are reported in milli-magnitudes, otherwise 1. */
  public double unitScale() {
    return Boolean.TRUE.equals(toMilli) ? 1000.0 : 1.0;
  }

  public String units() {
    return Boolean.TRUE.equals(toMilli) ? "mmag" : "mag";
  }

  public List<LocusDefinition> locusDefinitions() {
    return loci.stream().map(LocusProperties::toDefinition).toList();
  }

  /** One locus fit: three bands, polynomial degree and the region the fit may use. */
  public record LocusProperties(
      @NotBlank(message = "Locus name is required") String name,
      @NotNull(message = "Locus bands are required")
          @Size(min = 3, max = 3, message = "A locus needs exactly three bands")
          List<String> bands,
      @Min(value = 1, message = "Locus degree must be at least 1")
          @NotNull(message = "Locus degree is required")
          Integer degree,
      @Size(min = 2, max = 2, message = "x fit range needs [min, max]") List<Double> xFitRange,
      @Size(min = 2, max = 2, message = "y fit range needs [min, max]") List<Double> yFitRange,
      @Size(min = 2, max = 2, message = "Upper fit line needs [intercept, slope]")
          List<Double> fitLineUpper,
      @Size(min = 2, max = 2, message = "Lower fit line needs [intercept, slope]")
          List<Double> fitLineLower,
      LocusFitStrategy strategy,
      List<Double> initialGuess) {

    /**
     * @throws com.skyqa.locus.exception.InvalidRegionException if a range or line is malformed
     */
    public LocusDefinition toDefinition() {
      FitRegion region =
          FitRegion.builder()
              .xRange(xFitRange == null ? null : FitRegion.Range.of(toArray(xFitRange)))
              .yRange(yFitRange == null ? null : FitRegion.Range.of(toArray(yFitRange)))
              .upperLine(fitLineUpper == null ? null : FitLine.fromPair(toArray(fitLineUpper)))
              .lowerLine(fitLineLower == null ? null : FitLine.fromPair(toArray(fitLineLower)))
              .build();
      PolynomialModel guess =
          initialGuess == null || initialGuess.isEmpty()
              ? null
              : PolynomialModel.of(toArray(initialGuess));
      return new LocusDefinition(
          name, bands.get(0), bands.get(1), bands.get(2), degree, region, strategy, guess);
    }

    private static double[] toArray(List<Double> values) {
      return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
  }
}
