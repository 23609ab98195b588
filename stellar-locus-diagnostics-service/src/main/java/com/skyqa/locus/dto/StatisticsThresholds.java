package com.skyqa.locus.dto;

import java.util.Map;

/**
 * Limits checked by the statistics enforcer, keyed by label (e.g. {@code star}) and then statistic
 * name (e.g. {@code stdev}). A value must be strictly greater than its {@code requireGreater}
 * limit and strictly less than its {@code requireLess} limit.
 */
public record StatisticsThresholds(
    Map<String, Map<String, Double>> requireGreater, Map<String, Map<String, Double>> requireLess) {

  public StatisticsThresholds {
    requireGreater = requireGreater == null ? Map.of() : Map.copyOf(requireGreater);
    requireLess = requireLess == null ? Map.of() : Map.copyOf(requireLess);
  }

  public static StatisticsThresholds lessThan(String label, String statistic, double limit) {
    return new StatisticsThresholds(Map.of(), Map.of(label, Map.of(statistic, limit)));
  }

  public boolean isEmpty() {
    return requireGreater.isEmpty() && requireLess.isEmpty();
  }
}
