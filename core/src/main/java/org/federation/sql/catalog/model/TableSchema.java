/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Description of one table as published by a service's schema catalog. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TableSchema {

  @JsonProperty(required = true)
  private String name;

  private String description;

  private List<ColumnSchema> columns = new ArrayList<>();

  private List<TableRelation> relations = new ArrayList<>();

  private List<ExampleQuery> examples = new ArrayList<>();

  public static TableSchema of(String name, ColumnSchema... columns) {
    TableSchema table = new TableSchema();
    table.setName(name);
    table.setColumns(new ArrayList<>(Arrays.asList(columns)));
    return table;
  }

  /** Column whose name equals {@code columnName} ignoring case. */
  public Optional<ColumnSchema> findColumn(String columnName) {
    return columns.stream().filter(c -> c.getName().equalsIgnoreCase(columnName)).findFirst();
  }

  public Set<String> columnNames() {
    return columns.stream().map(ColumnSchema::getName).collect(Collectors.toSet());
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TableRelation {

    /** oneToOne, oneToMany, manyToOne or manyToMany. */
    private String type;

    private String table;
    private String sourceColumn;
    private String targetColumn;
    private String description;
  }

  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ExampleQuery {
    private String description;
    private String query;
  }
}
