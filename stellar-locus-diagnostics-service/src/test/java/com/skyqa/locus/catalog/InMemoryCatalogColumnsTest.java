package com.skyqa.locus.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("In-Memory Catalog Columns Tests")
class InMemoryCatalogColumnsTest {

  @Test
  @DisplayName("should keep numeric and flag columns apart")
  void shouldSeparateColumnKinds() {
    CatalogColumns catalog =
        InMemoryCatalogColumns.builder(2)
            .column("flux", new double[] {1.0, 2.0})
            .flag("bad", new boolean[] {true, false})
            .build();

    assertThat(catalog.hasColumn("flux")).isTrue();
    assertThat(catalog.hasFlag("flux")).isFalse();
    assertThat(catalog.flag("bad")).containsExactly(true, false);
    assertThatThrownBy(() -> catalog.column("bad")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should not expose its arrays")
  void shouldCopyArrays() {
    double[] flux = {1.0, 2.0};
    CatalogColumns catalog = InMemoryCatalogColumns.builder(2).column("flux", flux).build();

    flux[0] = 99.0;
    catalog.column("flux")[1] = 99.0;

    assertThat(catalog.column("flux")).containsExactly(1.0, 2.0);
  }

  @Test
  @DisplayName("should reject a column of the wrong length")
  void shouldRejectWrongLength() {
    assertThatThrownBy(() -> InMemoryCatalogColumns.builder(3).column("flux", new double[2]))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expected 3");
  }
}
