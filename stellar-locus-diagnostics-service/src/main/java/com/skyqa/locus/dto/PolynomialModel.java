package com.skyqa.locus.dto;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import org.apache.commons.math3.analysis.polynomials.PolynomialFunction;

/**
 * Immutable real polynomial with coefficients stored highest degree first, so {@code [a, b, c]}
 * is {@code a·x² + b·x + c}. Leading zeros are kept: the degree is always {@code length − 1}.
 *
 * <p>Evaluation and arithmetic go through a commons-math {@link PolynomialFunction}, which drops
 * high-order zeros; results are padded back to the degree the operation implies.
 */
public final class PolynomialModel {

  private final double[] coefficients;
  private final PolynomialFunction function;

  private PolynomialModel(double[] coefficients) {
    if (coefficients == null || coefficients.length == 0) {
      throw new IllegalArgumentException("A polynomial needs at least one coefficient");
    }
    this.coefficients = coefficients.clone();
    this.function = new PolynomialFunction(reverse(coefficients));
  }

  /** Coefficients highest degree first. */
  public static PolynomialModel of(double... highestFirst) {
    return new PolynomialModel(highestFirst);
  }

  /** Coefficients lowest degree first, the order optimisers and Vandermonde solvers work in. */
  public static PolynomialModel fromAscending(double... lowestFirst) {
    return new PolynomialModel(reverse(lowestFirst));
  }

  public static PolynomialModel line(double intercept, double slope) {
    return of(slope, intercept);
  }

  public int degree() {
    return coefficients.length - 1;
  }

  public double[] coefficients() {
    return coefficients.clone();
  }

  public double[] ascendingCoefficients() {
    return reverse(coefficients);
  }

  /** Coefficient of {@code x^power}. */
  public double coefficientOf(int power) {
    if (power < 0 || power > degree()) {
      return 0.0;
    }
    return coefficients[degree() - power];
  }

  /** The same polynomial as a commons-math function, for solvers and optimisers. */
  public PolynomialFunction asFunction() {
    return function;
  }

  public double evaluate(double x) {
    return function.value(x);
  }

  public PolynomialModel derivative() {
    return padded(function.polynomialDerivative(), Math.max(1, degree()));
  }

  public PolynomialModel add(PolynomialModel other) {
    return padded(
        function.add(other.function),
        Math.max(coefficients.length, other.coefficients.length));
  }

  public PolynomialModel subtract(PolynomialModel other) {
    return padded(
        function.subtract(other.function),
        Math.max(coefficients.length, other.coefficients.length));
  }

  public PolynomialModel multiply(PolynomialModel other) {
    return padded(
        function.multiply(other.function), coefficients.length + other.coefficients.length - 1);
  }

  public PolynomialModel scale(double factor) {
    return padded(
        function.multiply(new PolynomialFunction(new double[] {factor})), coefficients.length);
  }

  /** Drops leading coefficients that are exactly zero, keeping at least the constant term. */
  public PolynomialModel trimmed() {
    int first = 0;
    while (first < coefficients.length - 1 && coefficients[first] == 0.0) {
      first++;
    }
    return first == 0
        ? this
        : new PolynomialModel(Arrays.copyOfRange(coefficients, first, coefficients.length));
  }

  public boolean isFinite() {
    return Arrays.stream(coefficients).allMatch(Double::isFinite);
  }

  private static PolynomialModel padded(PolynomialFunction f, int length) {
    double[] ascending = Arrays.copyOf(f.getCoefficients(), length);
    return new PolynomialModel(reverse(ascending));
  }

  private static double[] reverse(double[] in) {
    double[] out = new double[in.length];
    for (int i = 0; i < in.length; i++) {
      out[i] = in[in.length - 1 - i];
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof PolynomialModel other && Arrays.equals(coefficients, other.coefficients);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coefficients);
  }

  @Override
  public String toString() {
    return Arrays.stream(coefficients)
        .mapToObj(c -> String.format(Locale.ROOT, "%.6g", c))
        .collect(Collectors.joining(", ", "PolynomialModel[", "]"));
  }
}
