package com.skyqa.locus;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Stellar Locus Diagnostics Service.
 *
 * <p>The service measures calibration quality of multi-band source catalogs. Clean bright stars are
 * selected, a polynomial is fitted to the stellar locus in each configured color-color plane, and
 * the scatter of the stars about that locus is summarised with clipped statistics and checked
 * against configured limits. The same robust statistics serve any per-object quantity, with a
 * systematic-error estimate when per-object errors are known.
 *
 * <p><strong>Key Components:</strong>
 *
 * <ul>
 *   <li>{@code LocusDiagnosticsService}: per-locus fit, distances and enforcement
 *   <li>{@code PrincipalColorStatisticsService}: range-limited principal colors and enforcement
 *   <li>{@code QuantityStatisticsService}: labelled clipped statistics and sysErr
 *   <li>{@code DiagnosticsProperties}: clip factors, star selection and locus definitions
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.skyqa.locus.config")
public class StellarLocusDiagnosticsApplication {

  public static void main(String[] args) {
    SpringApplication.run(StellarLocusDiagnosticsApplication.class, args);
  }
}
