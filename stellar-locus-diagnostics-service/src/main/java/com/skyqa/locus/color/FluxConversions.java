package com.skyqa.locus.color;

/** Flux to magnitude conversion. */
public final class FluxConversions {

  private FluxConversions() {}

  /** {@code zeroPoint − 2.5·log10(flux)}; NaN for a flux that is not finite and positive. */
  public static double magnitude(double flux, double zeroPoint) {
    if (!(flux > 0) || !Double.isFinite(flux)) {
      return Double.NaN;
    }
    return zeroPoint - 2.5 * Math.log10(flux);
  }

  public static double[] magnitudes(double[] fluxes, double zeroPoint) {
    double[] out = new double[fluxes.length];
    for (int i = 0; i < fluxes.length; i++) {
      out[i] = magnitude(fluxes[i], zeroPoint);
    }
    return out;
  }
}
