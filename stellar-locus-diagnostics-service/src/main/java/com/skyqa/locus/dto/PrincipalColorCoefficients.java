package com.skyqa.locus.dto;

import java.util.Map;

/**
 * Principal colors derived from a linear locus fit in a three-band color-color plane. {@code p1}
 * runs along the locus and {@code p2} across it; both vanish at the origin {@code (x0, y0)}.
 */
public record PrincipalColorCoefficients(
    Map<String, Double> p1,
    double p1Constant,
    Map<String, Double> p2,
    double p2Constant,
    double x0,
    double y0) {

  public PrincipalColorCoefficients {
    p1 = Map.copyOf(p1);
    p2 = Map.copyOf(p2);
  }

  public ColorTransform parallelTransform(String name) {
    return ColorTransform.builder()
        .name(name)
        .description(name + " (along the locus)")
        .coefficients(p1)
        .constant(p1Constant)
        .x0(x0)
        .y0(y0)
        .build();
  }

  public ColorTransform perpendicularTransform(String name) {
    return ColorTransform.builder()
        .name(name)
        .description(name + " (across the locus)")
        .coefficients(p2)
        .constant(p2Constant)
        .x0(x0)
        .y0(y0)
        .build();
  }
}
