/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.jdbc;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.data.model.Row;
import org.federation.sql.exception.SqlExecutionException;
import org.federation.sql.executor.SqlExecutor;

/**
 * {@link SqlExecutor} running statements over the connections of a {@link ServiceConnectionPool}.
 * Columns are keyed by their label and statements are never retried.
 */
@Log4j2
@RequiredArgsConstructor
public class JdbcSqlExecutor implements SqlExecutor {

  private final ServiceConnectionPool connectionPool;

  @Override
  public List<Row> execute(ServiceIdentifier service, String sql) {
    try {
      List<Row> rows = connectionPool.withConnection(service, connection -> query(connection, sql));
      log.debug("Service {} returned {} rows", service, rows.size());
      return rows;
    } catch (SQLException e) {
      throw new SqlExecutionException(service, e.getMessage(), e);
    }
  }

  private static List<Row> query(Connection connection, String sql) throws SQLException {
    try (Statement statement = connection.createStatement();
        ResultSet resultSet = statement.executeQuery(sql)) {
      return toRows(resultSet);
    }
  }

  private static List<Row> toRows(ResultSet resultSet) throws SQLException {
    ResultSetMetaData metaData = resultSet.getMetaData();
    int columnCount = metaData.getColumnCount();
    List<Row> rows = new ArrayList<>();
    while (resultSet.next()) {
      Row.Builder row = Row.builder();
      for (int i = 1; i <= columnCount; i++) {
        row.put(metaData.getColumnLabel(i), resultSet.getObject(i));
      }
      rows.add(row.build());
    }
    return rows;
  }
}
