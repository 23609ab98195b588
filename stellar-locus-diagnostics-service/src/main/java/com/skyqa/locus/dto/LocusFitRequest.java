package com.skyqa.locus.dto;

/**
 * Inputs of one stellar-locus fit. Use {@link #of(double[], double[], int)} for the defaults and
 * the {@code with*} methods to override them.
 */
public record LocusFitRequest(
    double[] x,
    double[] y,
    int degree,
    FitRegion region,
    double rejectionFactor,
    int iterations,
    LocusFitStrategy strategy,
    PolynomialModel initialGuess) {

  public static final double DEFAULT_REJECTION_FACTOR = 3.0;
  public static final int DEFAULT_ITERATIONS = 3;

  public LocusFitRequest {
    if (x == null || y == null || x.length != y.length) {
      throw new IllegalArgumentException("x and y must be non-null and of equal length");
    }
    if (degree < 1) {
      throw new IllegalArgumentException("Polynomial degree must be at least 1, got " + degree);
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("Iterations must be at least 1, got " + iterations);
    }
    if (!(rejectionFactor > 0)) {
      throw new IllegalArgumentException(
          "Rejection factor must be positive, got " + rejectionFactor);
    }
    if (initialGuess != null && initialGuess.degree() != degree) {
      throw new IllegalArgumentException(
          "Initial guess has degree " + initialGuess.degree() + " but the fit degree is " + degree);
    }
    x = x.clone();
    y = y.clone();
    region = region == null ? FitRegion.unbounded() : region;
    strategy = strategy == null ? LocusFitStrategy.STANDARD : strategy;
  }

  public static LocusFitRequest of(double[] x, double[] y, int degree) {
    return new LocusFitRequest(
        x,
        y,
        degree,
        null,
        DEFAULT_REJECTION_FACTOR,
        DEFAULT_ITERATIONS,
        LocusFitStrategy.STANDARD,
        null);
  }

  @Override
  public double[] x() {
    return x.clone();
  }

  @Override
  public double[] y() {
    return y.clone();
  }

  public int size() {
    return x.length;
  }

  public LocusFitRequest withRegion(FitRegion newRegion) {
    return new LocusFitRequest(
        x, y, degree, newRegion, rejectionFactor, iterations, strategy, initialGuess);
  }

  public LocusFitRequest withRejectionFactor(double newRejectionFactor) {
    return new LocusFitRequest(
        x, y, degree, region, newRejectionFactor, iterations, strategy, initialGuess);
  }

  public LocusFitRequest withIterations(int newIterations) {
    return new LocusFitRequest(
        x, y, degree, region, rejectionFactor, newIterations, strategy, initialGuess);
  }

  public LocusFitRequest withStrategy(LocusFitStrategy newStrategy) {
    return new LocusFitRequest(
        x, y, degree, region, rejectionFactor, iterations, newStrategy, initialGuess);
  }

  public LocusFitRequest withInitialGuess(PolynomialModel newInitialGuess) {
    return new LocusFitRequest(
        x, y, degree, region, rejectionFactor, iterations, strategy, newInitialGuess);
  }
}
