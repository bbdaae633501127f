/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ColumnSchema {

  @JsonProperty(required = true)
  private String name;

  private String type;

  private String description;

  @JsonProperty("isPrimaryKey")
  private boolean primaryKey;

  @JsonProperty("isUnique")
  private boolean unique;

  @JsonProperty("isNullable")
  private boolean nullable;

  @JsonProperty("isForeignKey")
  private boolean foreignKey;

  private ColumnReference references;

  public static ColumnSchema of(String name, String type) {
    ColumnSchema column = new ColumnSchema();
    column.setName(name);
    column.setType(type);
    return column;
  }

  /** Target of a foreign key column. */
  @Data
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ColumnReference {
    private String table;
    private String column;
  }
}
