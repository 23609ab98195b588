package com.skyqa.locus.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Clipped Statistics Tests")
class ClippedStatisticsTest {

  private final ClippedStatistics stats =
      new ClippedStatistics(10, 8, 0.5, 0.4, 0.02, 0.1, null, null, new boolean[10]);

  @Test
  @DisplayName("should look statistics up by name")
  void shouldLookUpByName() {
    assertThat(stats.statistic("mean")).isEqualTo(0.5);
    assertThat(stats.statistic("stdev")).isEqualTo(0.02);
    assertThat(stats.statistic("num")).isEqualTo(8.0);
    assertThat(stats.statistic("total")).isEqualTo(10.0);
    assertThat(stats.statistic("sysErr")).isNaN();
    assertThatThrownBy(() -> stats.statistic("kurtosis"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("kurtosis");
  }

  @Test
  @DisplayName("should scale location and spread but not counts")
  void shouldScale() {
    ClippedStatistics milli = stats.withSysErr(0.003).scaled(1000.0);

    assertThat(milli.mean()).isEqualTo(500.0);
    assertThat(milli.stdev()).isEqualTo(20.0);
    assertThat(milli.sysErr()).isEqualTo(3.0);
    assertThat(milli.numUsed()).isEqualTo(8);
  }

  @Test
  @DisplayName("should describe an empty sample with NaN values")
  void shouldBuildEmpty() {
    ClippedStatistics empty = ClippedStatistics.empty(4, 1.0);

    assertThat(empty.isEmpty()).isTrue();
    assertThat(empty.mean()).isNaN();
    assertThat(empty.forcedMean()).isEqualTo(1.0);
    assertThat(empty.usedMask()).hasSize(4).containsOnly(false);
  }

  @Test
  @DisplayName("should reject more used than total")
  void shouldRejectInconsistentCounts() {
    assertThatThrownBy(
            () -> new ClippedStatistics(2, 3, 0.0, 0.0, 0.0, 0.0, null, null, new boolean[3]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
