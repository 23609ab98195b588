package com.skyqa.locus.catalog;

import java.util.Set;

/**
 * Read access to a per-band source catalog by column name.
 *
 * <p>Numeric columns and boolean flag columns are kept apart so a misspelt flag cannot silently be
 * read as a number. Every column of a catalog has {@link #size()} entries, one per object, in the
 * same object order.
 */
public interface CatalogColumns {

  int size();

  Set<String> columnNames();

  Set<String> flagNames();

  default boolean hasColumn(String name) {
    return columnNames().contains(name);
  }

  default boolean hasFlag(String name) {
    return flagNames().contains(name);
  }

  /**
   * @throws IllegalArgumentException if the catalog has no such numeric column
   */
  double[] column(String name);

  /**
   * @throws IllegalArgumentException if the catalog has no such flag column
   */
  boolean[] flag(String name);
}
