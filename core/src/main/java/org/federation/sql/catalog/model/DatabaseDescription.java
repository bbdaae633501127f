/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Everything the catalog knows about one service's database. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseDescription {

  private static final Logger LOG = LogManager.getLogger();

  private String name;

  @JsonProperty(required = true)
  private ServiceIdentifier service;

  private String description;

  private List<TableSchema> tables = new ArrayList<>();

  private List<TableSchema.ExampleQuery> commonQueries = new ArrayList<>();

  public static DatabaseDescription of(ServiceIdentifier service, TableSchema... tables) {
    DatabaseDescription database = new DatabaseDescription();
    database.setName(service.getServiceName());
    database.setService(service);
    database.setTables(new ArrayList<>(Arrays.asList(tables)));
    return database;
  }

  /** Table whose name equals {@code tableName} ignoring case. */
  public Optional<TableSchema> findTable(String tableName) {
    return tables.stream().filter(t -> t.getName().equalsIgnoreCase(tableName)).findFirst();
  }

  /**
   * Converts inputstream of bytes into list of database descriptions.
   *
   * @param inputStream inputstream.
   * @return List of database descriptions.
   */
  public static List<DatabaseDescription> fromInputStream(InputStream inputStream) {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    try {
      return objectMapper.readValue(inputStream, new TypeReference<>() {});
    } catch (IOException e) {
      LOG.error("Schema catalog file is malformed. Verify and reload.");
      throw new IllegalArgumentException("Malformed schema catalog json: " + e.getMessage(), e);
    }
  }
}
