package com.skyqa.locus.color;

import com.skyqa.locus.dto.ColorTransform;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Registry of the wired color transforms.
 *
 * <p>The principal colors are those of Ivezic et al. (2004): w and x from g, r, i and y from r, i,
 * z. {@code Perp} colors run across the stellar locus and are the quality measure; {@code Para}
 * colors run along it and restrict which stars count. The HSC set also holds the straight-line
 * fits ({@code wFit}, {@code xFit}, {@code yFit}) from which its perpendicular colors were
 * calibrated, and the bounding lines used to pick stars along each locus segment.
 */
@Component
public class ColorTransformCatalog {

  /** Photometric systems with wired principal-color transforms. */
  public enum TransformSet {
    HSC,
    SDSS,
    /** Single-band identities, used to carry magnitudes through the same machinery. */
    STRAIGHT
  }

  private static final String GRI_BLUE = " (griBlue)";
  private static final String GRI_RED = " (griRed)";
  private static final String RIZ_RED = " (rizRed)";

  private final Map<TransformSet, Map<String, ColorTransform>> transforms;

  public ColorTransformCatalog() {
    Map<TransformSet, Map<String, ColorTransform>> all = new LinkedHashMap<>();
    all.put(TransformSet.HSC, Collections.unmodifiableMap(hscTransforms()));
    all.put(TransformSet.SDSS, Collections.unmodifiableMap(sdssTransforms()));
    all.put(TransformSet.STRAIGHT, Collections.unmodifiableMap(straightTransforms()));
    this.transforms = Collections.unmodifiableMap(all);
  }

  public Map<String, ColorTransform> transforms(TransformSet set) {
    return transforms.get(set);
  }

  /**
   * @throws IllegalArgumentException if the set has no transform of that name
   */
  public ColorTransform get(TransformSet set, String name) {
    ColorTransform transform = transforms.get(set).get(name);
    if (transform == null) {
      throw new IllegalArgumentException("No " + set + " color transform named " + name);
    }
    return transform;
  }

  // ============================================================================
  // HSC
  // ============================================================================

  private static Map<String, ColorTransform> hscTransforms() {
    Map<String, ColorTransform> m = new LinkedHashMap<>();
    m.put(
        "wPerp",
        ColorTransform.builder()
            .name("wPerp")
            .description("Ivezic w perpendicular")
            .subDescription(GRI_BLUE)
            .plot(true)
            .coefficients(bands("HSC-G", -0.272, "HSC-R", 0.803, "HSC-I", -0.531))
            .constant(0.036)
            .x0(0.4481)
            .y0(0.1546)
            .requireGreater(Map.of("wPara", -0.2))
            .requireLess(Map.of("wPara", 0.6))
            .fitLineSlope(-1 / 0.51)
            .fitLineUpperIntercept(2.40)
            .fitLineLowerIntercept(0.68)
            .build());
    m.put(
        "xPerp",
        ColorTransform.builder()
            .name("xPerp")
            .description("Ivezic x perpendicular")
            .subDescription(GRI_RED)
            .plot(true)
            .coefficients(bands("HSC-G", 0.678, "HSC-R", -0.733, "HSC-I", 0.055))
            .constant(-0.792)
            .x0(1.2654)
            .y0(1.3675)
            .requireGreater(Map.of("xPara", 0.8))
            .requireLess(Map.of("xPara", 1.6))
            .fitLineSlope(-1 / 11.4)
            .fitLineUpperIntercept(1.73)
            .fitLineLowerIntercept(0.87)
            .build());
    m.put(
        "yPerp",
        ColorTransform.builder()
            .name("yPerp")
            .description("Ivezic y perpendicular")
            .subDescription(RIZ_RED)
            .plot(true)
            .coefficients(bands("HSC-R", -0.227, "HSC-I", 0.793, "HSC-Z", -0.566))
            .constant(-0.012)
            .x0(1.2219)
            .y0(0.5183)
            .requireGreater(Map.of("yPara", 0.1))
            .requireLess(Map.of("yPara", 1.2))
            .fitLineSlope(-1 / 0.40)
            .fitLineUpperIntercept(5.5)
            .fitLineLowerIntercept(2.7)
            .build());
    // Parallel colors still carry the SDSS-derived values.
    m.put(
        "wPara",
        parallel(
            "wPara", "Ivezic w parallel", GRI_BLUE,
            bands("HSC-G", 0.89, "HSC-R", -0.43, "HSC-I", -0.46), -0.52));
    m.put(
        "xPara",
        parallel(
            "xPara", "Ivezic x parallel", GRI_RED,
            bands("HSC-G", 0.0, "HSC-R", 1.0, "HSC-I", -1.0), 0.0));
    m.put(
        "yPara",
        parallel(
            "yPara", "Ivezic y parallel", RIZ_RED,
            bands("HSC-R", 0.928, "HSC-I", -0.555, "HSC-Z", -0.373), -1.400));
    m.put(
        "wFit",
        parallel(
            "wFit", "Straight line fit for wPerp range", GRI_BLUE,
            bands("HSC-G", 0.51, "HSC-R", -0.51), -0.07));
    m.put(
        "xFit",
        parallel(
            "xFit", "Straight line fit for xPerp range", GRI_RED,
            bands("HSC-G", 11.4, "HSC-R", -11.4), -13.3));
    m.put(
        "yFit",
        parallel(
            "yFit", "Straight line fit for yPerp range", RIZ_RED,
            bands("HSC-R", 0.40, "HSC-I", -0.40), 0.02));
    return m;
  }

  // ============================================================================
  // SDSS
  // ============================================================================

  private static Map<String, ColorTransform> sdssTransforms() {
    Map<String, ColorTransform> m = new LinkedHashMap<>();
    m.put(
        "wPerp",
        ColorTransform.builder()
            .name("wPerp")
            .description("Ivezic w perpendicular")
            .subDescription(GRI_BLUE)
            .plot(true)
            .coefficients(bands("SDSS-G", -0.227, "SDSS-R", 0.792, "SDSS-I", -0.567))
            .constant(0.050)
            .x0(0.4250)
            .y0(0.0818)
            .requireGreater(Map.of("wPara", -0.2))
            .requireLess(Map.of("wPara", 0.6))
            .build());
    m.put(
        "xPerp",
        ColorTransform.builder()
            .name("xPerp")
            .description("Ivezic x perpendicular")
            .subDescription(GRI_RED)
            .plot(true)
            .coefficients(bands("SDSS-G", 0.707, "SDSS-R", -0.707))
            .constant(-0.988)
            .requireGreater(Map.of("xPara", 0.8))
            .requireLess(Map.of("xPara", 1.6))
            .build());
    m.put(
        "yPerp",
        ColorTransform.builder()
            .name("yPerp")
            .description("Ivezic y perpendicular")
            .subDescription(RIZ_RED)
            .plot(true)
            .coefficients(bands("SDSS-R", -0.270, "SDSS-I", 0.800, "SDSS-Z", -0.534))
            .constant(0.054)
            .x0(0.5763)
            .y0(0.1900)
            .requireGreater(Map.of("yPara", 0.1))
            .requireLess(Map.of("yPara", 1.2))
            .build());
    m.put(
        "wPara",
        parallel(
            "wPara", "Ivezic w parallel", GRI_BLUE,
            bands("SDSS-G", 0.928, "SDSS-R", -0.556, "SDSS-I", -0.372), -0.425));
    m.put(
        "xPara",
        parallel(
            "xPara", "Ivezic x parallel", GRI_RED, bands("SDSS-R", 1.0, "SDSS-I", -1.0), 0.0));
    m.put(
        "yPara",
        parallel(
            "yPara", "Ivezic y parallel", RIZ_RED,
            bands("SDSS-R", 0.895, "SDSS-I", -0.448, "SDSS-Z", -0.447), -0.600));
    return m;
  }

  private static Map<String, ColorTransform> straightTransforms() {
    Map<String, ColorTransform> m = new LinkedHashMap<>();
    m.put("g", straight("g", "HSC-G"));
    m.put("r", straight("r", "HSC-R"));
    m.put("i", straight("i", "HSC-I"));
    m.put("z", straight("z", "HSC-Z"));
    m.put("y", straight("y", "HSC-Y"));
    m.put("n921", straight("n921", "NB0921"));
    return m;
  }

  private static ColorTransform parallel(
      String name,
      String description,
      String subDescription,
      Map<String, Double> coefficients,
      double constant) {
    return ColorTransform.builder()
        .name(name)
        .description(description)
        .subDescription(subDescription)
        .coefficients(coefficients)
        .constant(constant)
        .build();
  }

  private static ColorTransform straight(String name, String band) {
    return ColorTransform.builder()
        .name(name)
        .description(band)
        .plot(true)
        .coefficients(Map.of(band, 1.0))
        .build();
  }

  /** Ordered band → coefficient map from alternating name/value arguments. */
  private static Map<String, Double> bands(Object... bandAndCoefficient) {
    Map<String, Double> m = new LinkedHashMap<>();
    for (int i = 0; i < bandAndCoefficient.length; i += 2) {
      m.put((String) bandAndCoefficient[i], ((Number) bandAndCoefficient[i + 1]).doubleValue());
    }
    return m;
  }
}
