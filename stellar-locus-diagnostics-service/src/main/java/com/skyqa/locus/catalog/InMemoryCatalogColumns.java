package com.skyqa.locus.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** {@link CatalogColumns} over arrays already held in memory. Arrays are copied both ways. */
public final class InMemoryCatalogColumns implements CatalogColumns {

  private final int size;
  private final Map<String, double[]> columns;
  private final Map<String, boolean[]> flags;

  private InMemoryCatalogColumns(
      int size, Map<String, double[]> columns, Map<String, boolean[]> flags) {
    this.size = size;
    this.columns = Collections.unmodifiableMap(columns);
    this.flags = Collections.unmodifiableMap(flags);
  }

  public static Builder builder(int size) {
    return new Builder(size);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public Set<String> columnNames() {
    return columns.keySet();
  }

  @Override
  public Set<String> flagNames() {
    return flags.keySet();
  }

  @Override
  public double[] column(String name) {
    double[] values = columns.get(name);
    if (values == null) {
      throw new IllegalArgumentException("No numeric column named " + name);
    }
    return values.clone();
  }

  @Override
  public boolean[] flag(String name) {
    boolean[] values = flags.get(name);
    if (values == null) {
      throw new IllegalArgumentException("No flag column named " + name);
    }
    return values.clone();
  }

  /** Collects columns and checks each has the catalog's length. */
  public static final class Builder {

    private final int size;
    private final Map<String, double[]> columns = new LinkedHashMap<>();
    private final Map<String, boolean[]> flags = new LinkedHashMap<>();

    private Builder(int size) {
      if (size < 0) {
        throw new IllegalArgumentException("Catalog size must be non-negative");
      }
      this.size = size;
    }

    public Builder column(String name, double[] values) {
      if (values.length != size) {
        throw new IllegalArgumentException(
            "Column " + name + " has " + values.length + " entries, expected " + size);
      }
      columns.put(name, values.clone());
      return this;
    }

    public Builder flag(String name, boolean[] values) {
      if (values.length != size) {
        throw new IllegalArgumentException(
            "Flag " + name + " has " + values.length + " entries, expected " + size);
      }
      flags.put(name, values.clone());
      return this;
    }

    public InMemoryCatalogColumns build() {
      return new InMemoryCatalogColumns(
          size, new LinkedHashMap<>(columns), new LinkedHashMap<>(flags));
    }
  }
}
