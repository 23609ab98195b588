package com.skyqa.locus.dto;

import java.util.Arrays;

/**
 * Per-object quantity with its parallel magnitudes, optional errors and selection mask.
 *
 * <p>All arrays are copied on the way in and on the way out, so a sample can be shared between
 * threads. Entries whose value is NaN are never selected, whatever the mask says.
 */
public record ScalarSample(
    double[] values, double[] magnitudes, double[] errors, boolean[] selectionMask) {

  public ScalarSample {
    if (values == null) {
      throw new IllegalArgumentException("Values are required");
    }
    int n = values.length;
    if (magnitudes == null) {
      magnitudes = filled(n, Double.NaN);
    }
    if (selectionMask == null) {
      selectionMask = new boolean[n];
      Arrays.fill(selectionMask, true);
    }
    if (magnitudes.length != n
        || selectionMask.length != n
        || (errors != null && errors.length != n)) {
      throw new IllegalArgumentException(
          String.format(
              "Sample arrays must have equal lengths: values=%d, magnitudes=%d, errors=%s, mask=%d",
              n,
              magnitudes.length,
              errors == null ? "none" : String.valueOf(errors.length),
              selectionMask.length));
    }
    values = values.clone();
    magnitudes = magnitudes.clone();
    errors = errors == null ? null : errors.clone();
    selectionMask = selectionMask.clone();
  }

  /** Sample with every object selected and no magnitudes or errors. */
  public static ScalarSample of(double[] values) {
    return new ScalarSample(values, null, null, null);
  }

  public static ScalarSample of(double[] values, boolean[] selectionMask) {
    return new ScalarSample(values, null, null, selectionMask);
  }

  @Override
  public double[] values() {
    return values.clone();
  }

  @Override
  public double[] magnitudes() {
    return magnitudes.clone();
  }

  @Override
  public double[] errors() {
    return errors == null ? null : errors.clone();
  }

  @Override
  public boolean[] selectionMask() {
    return selectionMask.clone();
  }

  public int size() {
    return values.length;
  }

  public boolean hasErrors() {
    return errors != null;
  }

  public double valueAt(int index) {
    return values[index];
  }

  public double errorAt(int index) {
    return errors == null ? Double.NaN : errors[index];
  }

  /** True when the object is both masked in and carries a finite value. */
  public boolean isSelected(int index) {
    return selectionMask[index] && Double.isFinite(values[index]);
  }

  public int selectedCount() {
    int count = 0;
    for (int i = 0; i < values.length; i++) {
      if (isSelected(i)) {
        count++;
      }
    }
    return count;
  }

  /**
   * Restricts the selection to objects brighter than the threshold. Objects with a NaN magnitude
   * drop out.
   */
  public ScalarSample brighterThan(double magnitudeThreshold) {
    boolean[] mask = selectionMask.clone();
    for (int i = 0; i < mask.length; i++) {
      mask[i] &= magnitudes[i] < magnitudeThreshold;
    }
    return new ScalarSample(values, magnitudes, errors, mask);
  }

  /** Copy of this sample carrying different values; used for error-normalised quantities. */
  public ScalarSample withValues(double[] newValues) {
    return new ScalarSample(newValues, magnitudes, errors, selectionMask);
  }

  public ScalarSample withSelection(boolean[] newMask) {
    return new ScalarSample(values, magnitudes, errors, newMask);
  }

  private static double[] filled(int n, double value) {
    double[] out = new double[n];
    Arrays.fill(out, value);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ScalarSample other)) {
      return false;
    }
    return Arrays.equals(values, other.values)
        && Arrays.equals(magnitudes, other.magnitudes)
        && Arrays.equals(errors, other.errors)
        && Arrays.equals(selectionMask, other.selectionMask);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(values);
    result = 31 * result + Arrays.hashCode(magnitudes);
    result = 31 * result + Arrays.hashCode(errors);
    return 31 * result + Arrays.hashCode(selectionMask);
  }

  @Override
  public String toString() {
    return "ScalarSample[size=" + values.length + ", selected=" + selectedCount() + "]";
  }
}
