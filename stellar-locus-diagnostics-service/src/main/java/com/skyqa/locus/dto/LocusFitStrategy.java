package com.skyqa.locus.dto;

/** How the ordinary least-squares seed of a locus fit is obtained. */
public enum LocusFitStrategy {
  /** Iteratively clipped OLS fit of y on x. */
  STANDARD,
  /**
   * Near-vertical locus: OLS on y(x) is unstable at very steep slopes, so a steep line is used as
   * the seed instead.
   */
  VERTICAL
}
