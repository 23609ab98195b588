package com.skyqa.locus.dto;

/**
 * Outcome of a stellar-locus fit.
 *
 * @param model orthogonal-regression polynomial, the fit used downstream
 * @param ordinaryLeastSquaresModel seed polynomial from the clipped OLS stage
 * @param keepMask points used in the final orthogonal round
 * @param ordinaryLeastSquaresKeepMask points used in the final OLS fit
 * @param iterations clip iterations performed per stage
 */
public record LocusFitResult(
    PolynomialModel model,
    PolynomialModel ordinaryLeastSquaresModel,
    boolean[] keepMask,
    boolean[] ordinaryLeastSquaresKeepMask,
    int iterations) {

  public LocusFitResult {
    keepMask = keepMask.clone();
    ordinaryLeastSquaresKeepMask = ordinaryLeastSquaresKeepMask.clone();
  }

  @Override
  public boolean[] keepMask() {
    return keepMask.clone();
  }

  @Override
  public boolean[] ordinaryLeastSquaresKeepMask() {
    return ordinaryLeastSquaresKeepMask.clone();
  }

  public int keptCount() {
    int count = 0;
    for (boolean keep : keepMask) {
      if (keep) {
        count++;
      }
    }
    return count;
  }

  public double[] coefficients() {
    return model.coefficients();
  }
}
