package com.skyqa.locus.algorithm;

import com.skyqa.locus.algorithm.util.Masks;
import com.skyqa.locus.algorithm.util.Quartiles;
import com.skyqa.locus.dto.ClippedStatistics;
import com.skyqa.locus.dto.ScalarSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sigma-clipped location and scale summary of a per-object quantity.
 *
 * <p>ALGORITHM:
 *
 * <ol>
 *   <li>Selected = selection mask ∧ finite value. Nothing selected gives the empty result.
 *   <li>Quartiles Q1, median, Q3 of the selected values (linear interpolation).
 *   <li>clipThreshold = k · 0.74 · (Q3 − Q1), the interquartile range scaled to a Gaussian sigma.
 *   <li>Used = selected ∧ |value − median| ≤ clipThreshold.
 *   <li>mean = mean of the used values, or the forced mean when one is given; stdev is the RMS
 *       deviation of the used values about that mean.
 * </ol>
 *
 * <p>A zero interquartile range with no values exactly at the median cannot leave anything used;
 * the full selected set is summarised instead. Numeric content never raises: degenerate inputs come
 * back as NaN statistics.
 */
@Component
public class RobustStatisticsCalculator {

  private static final Logger logger = LoggerFactory.getLogger(RobustStatisticsCalculator.class);

  /** Interquartile range of a unit Gaussian is 1.349; its inverse converts IQR to sigma. */
  public static final double IQR_TO_SIGMA = 0.74;

  public static final double DEFAULT_CLIP_FACTOR = 4.0;

  public ClippedStatistics computeRobustStatistics(ScalarSample sample) {
    return computeRobustStatistics(sample, DEFAULT_CLIP_FACTOR, null);
  }

  /**
   * Call-style entry point over parallel arrays.
   *
   * @param magnitudes carried for symmetry with the sample model; not used in the summary
   * @param forcedMean mean to use instead of the measured one, or null
   */
  public ClippedStatistics computeRobustStatistics(
      double[] values,
      double[] magnitudes,
      boolean[] selection,
      double clipFactor,
      Double forcedMean) {
    return computeRobustStatistics(
        new ScalarSample(values, magnitudes, null, selection), clipFactor, forcedMean);
  }

  public ClippedStatistics computeRobustStatistics(
      ScalarSample sample, double clipFactor, Double forcedMean) {
    int n = sample.size();
    boolean[] selected = new boolean[n];
    for (int i = 0; i < n; i++) {
      selected[i] = sample.isSelected(i);
    }
    int total = Masks.count(selected);
    if (total == 0) {
      logger.debug("No selected finite values among {} objects", n);
      return ClippedStatistics.empty(n, forcedMean);
    }

    double[] values = sample.values();
    Quartiles quartiles = Quartiles.of(Masks.select(values, selected));
    double median = quartiles.median();
    double clipThreshold = clipFactor * IQR_TO_SIGMA * quartiles.interquartileRange();

    boolean[] used = new boolean[n];
    for (int i = 0; i < n; i++) {
      used[i] = selected[i] && !(Math.abs(values[i] - median) > clipThreshold);
    }
    if (Masks.count(used) == 0) {
      logger.debug(
          "Clip threshold {} rejected all {} values, using the full selection",
          clipThreshold,
          total);
      used = selected;
    }

    double[] usedValues = Masks.select(values, used);
    double mean = forcedMean != null ? forcedMean : mean(usedValues);
    double stdev = rmsAbout(usedValues, mean);
    return new ClippedStatistics(
        total, usedValues.length, mean, median, stdev, clipThreshold, forcedMean, null, used);
  }

  private static double mean(double[] values) {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  private static double rmsAbout(double[] values, double center) {
    double sum = 0.0;
    for (double v : values) {
      double d = v - center;
      sum += d * d;
    }
    return Math.sqrt(sum / values.length);
  }
}
