package com.skyqa.locus.catalog;

import com.skyqa.locus.color.FluxConversions;
import com.skyqa.locus.config.DiagnosticsProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the clean, bright point sources used for locus fits.
 *
 * <p>An object is kept when
 *
 * <ul>
 *   <li>none of the configured bad flags is set in any band (flags a catalog lacks are ignored),
 *   <li>it is classified as a star in the reference band,
 *   <li>it is classified as a star in at least {@code minStarBands} bands,
 *   <li>its reference-band magnitude is brighter than {@code magThreshold}.
 * </ul>
 *
 * A star is an object whose classification value is below {@link #STAR_CLASSIFICATION_LIMIT}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StarSelector {

  public static final double STAR_CLASSIFICATION_LIMIT = 0.5;

  private final DiagnosticsProperties properties;

  /**
   * Magnitudes from the configured flux column of every band.
   *
   * @throws IllegalArgumentException if a band lacks the flux column or bands differ in size
   */
  public Map<String, double[]> magnitudes(Map<String, CatalogColumns> catalogsByBand) {
    int size = commonSize(catalogsByBand);
    Map<String, double[]> mags = new LinkedHashMap<>();
    catalogsByBand.forEach(
        (band, catalog) ->
            mags.put(
                band,
                FluxConversions.magnitudes(
                    catalog.column(properties.fluxColumn()), properties.zeroPoint())));
    log.debug("Computed magnitudes for {} objects in bands {}", size, mags.keySet());
    return mags;
  }

  /**
   * @param magnitudesByBand output of {@link #magnitudes(Map)}
   * @throws IllegalArgumentException if the reference band is missing
   */
  public boolean[] selectStars(
      Map<String, CatalogColumns> catalogsByBand, Map<String, double[]> magnitudesByBand) {
    int size = commonSize(catalogsByBand);
    CatalogColumns reference = catalogsByBand.get(properties.referenceBand());
    double[] referenceMags = magnitudesByBand.get(properties.referenceBand());
    if (reference == null || referenceMags == null) {
      throw new IllegalArgumentException(
          "Reference band " + properties.referenceBand() + " is not in the catalog set");
    }

    boolean[] bad = new boolean[size];
    int[] starBands = new int[size];
    for (Map.Entry<String, CatalogColumns> entry : catalogsByBand.entrySet()) {
      CatalogColumns catalog = entry.getValue();
      for (String flag : properties.badFlags()) {
        if (!catalog.hasFlag(flag)) {
          log.debug("Flag {} not in the {} catalog, ignoring it", flag, entry.getKey());
          continue;
        }
        boolean[] set = catalog.flag(flag);
        for (int i = 0; i < size; i++) {
          bad[i] |= set[i];
        }
      }
      if (catalog.hasColumn(properties.classificationColumn())) {
        double[] classification = catalog.column(properties.classificationColumn());
        for (int i = 0; i < size; i++) {
          if (classification[i] < STAR_CLASSIFICATION_LIMIT) {
            starBands[i]++;
          }
        }
      }
    }

    double[] referenceClass =
        reference.hasColumn(properties.classificationColumn())
            ? reference.column(properties.classificationColumn())
            : null;
    boolean[] good = new boolean[size];
    int count = 0;
    for (int i = 0; i < size; i++) {
      good[i] =
          referenceClass != null
              && referenceClass[i] < STAR_CLASSIFICATION_LIMIT
              && starBands[i] >= properties.minStarBands()
              && !bad[i]
              && referenceMags[i] < properties.magThreshold();
      if (good[i]) {
        count++;
      }
    }
    log.info(
        "Selected {} of {} objects as clean stars brighter than {}",
        count,
        size,
        properties.magThreshold());
    return good;
  }

  private static int commonSize(Map<String, CatalogColumns> catalogsByBand) {
    if (catalogsByBand.isEmpty()) {
      throw new IllegalArgumentException("At least one band catalog is required");
    }
    int size = -1;
    for (Map.Entry<String, CatalogColumns> entry : catalogsByBand.entrySet()) {
      int n = entry.getValue().size();
      if (size < 0) {
        size = n;
      } else if (n != size) {
        throw new IllegalArgumentException(
            "Band " + entry.getKey() + " has " + n + " objects, expected " + size);
      }
    }
    return size;
  }
}
