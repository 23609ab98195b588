package com.skyqa.locus.algorithm.util;

import java.util.Arrays;

/** Helpers for the boolean selection masks that travel alongside per-object arrays. */
public final class Masks {

  private Masks() {}

  public static int count(boolean[] mask) {
    int count = 0;
    for (boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /** Values at the positions where the mask is set, in order. */
  public static double[] select(double[] values, boolean[] mask) {
    double[] out = new double[count(mask)];
    int j = 0;
    for (int i = 0; i < values.length; i++) {
      if (mask[i]) {
        out[j++] = values[i];
      }
    }
    return out;
  }

  public static boolean[] finite(double[] x, double[] y) {
    boolean[] out = new boolean[x.length];
    for (int i = 0; i < x.length; i++) {
      out[i] = Double.isFinite(x[i]) && Double.isFinite(y[i]);
    }
    return out;
  }

  public static boolean[] and(boolean[] a, boolean[] b) {
    boolean[] out = new boolean[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = a[i] && b[i];
    }
    return out;
  }

  public static boolean[] allTrue(int length) {
    boolean[] out = new boolean[length];
    Arrays.fill(out, true);
    return out;
  }
}
