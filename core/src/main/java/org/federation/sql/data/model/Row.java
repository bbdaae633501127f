/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.data.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One result row: an ordered mapping of column name to {@link RowValue}. Rows are immutable;
 * operators that combine or reshape rows build new ones through {@link Builder}.
 */
public final class Row {

  private final Map<String, RowValue> values;

  private Row(Map<String, RowValue> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Build a row from alternating column names and values, e.g. {@code Row.of("id", 1, "name",
   * "a")}.
   */
  public static Row of(Object... columnsAndValues) {
    if (columnsAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Row.of expects column/value pairs");
    }
    Builder builder = builder();
    for (int i = 0; i < columnsAndValues.length; i += 2) {
      builder.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
    }
    return builder.build();
  }

  /** Build a row from a map, keeping the map's iteration order. */
  public static Row fromMap(Map<String, ?> map) {
    Builder builder = builder();
    map.forEach(builder::put);
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Copy of this row that can be extended or overridden. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.values.putAll(values);
    return builder;
  }

  /** Value of the column, {@link RowValue#NULL} when absent. */
  public RowValue get(String column) {
    return values.getOrDefault(column, RowValue.NULL);
  }

  public boolean has(String column) {
    return values.containsKey(column);
  }

  /** First column whose name equals {@code column} ignoring case. */
  public Optional<Map.Entry<String, RowValue>> findIgnoreCase(String column) {
    return values.entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(column))
        .findFirst();
  }

  public Set<String> columns() {
    return values.keySet();
  }

  public Map<String, RowValue> asMap() {
    return values;
  }

  /** Plain Java view of the row for callers that do not want the value wrapper. */
  public Map<String, Object> toJavaMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    values.forEach((column, value) -> map.put(column, value.toJavaObject()));
    return map;
  }

  public int size() {
    return values.size();
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Row && values.equals(((Row) o).values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.entrySet().stream()
        .map(entry -> entry.getKey() + ":" + entry.getValue())
        .collect(Collectors.joining(",", "{", "}"));
  }

  /** Mutable builder, insertion ordered. */
  public static final class Builder {

    private final Map<String, RowValue> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String column, Object value) {
      values.put(column, RowValue.of(value));
      return this;
    }

    public Builder putAll(Row row) {
      values.putAll(row.values);
      return this;
    }

    public Row build() {
      return new Row(new LinkedHashMap<>(values));
    }
  }
}
