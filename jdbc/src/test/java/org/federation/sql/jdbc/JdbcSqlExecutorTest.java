/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.common.setting.PropertiesSettings;
import org.federation.sql.data.model.Row;
import org.federation.sql.exception.SqlExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class JdbcSqlExecutorTest {

  private static final String SQL = "SELECT \"userId\", amount FROM \"Transaction\"";

  @Mock private ServiceConnectionPool.ConnectionFactory connectionFactory;

  @Mock private Connection connection;

  @Mock private Statement statement;

  @Mock private ResultSet resultSet;

  @Mock private ResultSetMetaData metaData;

  private JdbcSqlExecutor executor;

  @BeforeEach
  void setUp() throws SQLException {
    Properties properties = new Properties();
    properties.setProperty("federation.datasource.wallet.url", "jdbc:postgresql://wallet/db");
    executor =
        new JdbcSqlExecutor(
            new ServiceConnectionPool(new PropertiesSettings(properties), connectionFactory));
    when(connectionFactory.connect(any(), any(), any())).thenReturn(connection);
    when(connection.createStatement()).thenReturn(statement);
  }

  @Test
  void rows_are_keyed_by_column_label() throws SQLException {
    when(statement.executeQuery(SQL)).thenReturn(resultSet);
    when(resultSet.getMetaData()).thenReturn(metaData);
    when(metaData.getColumnCount()).thenReturn(2);
    when(metaData.getColumnLabel(1)).thenReturn("userId");
    when(metaData.getColumnLabel(2)).thenReturn("amount");
    when(resultSet.next()).thenReturn(true, true, false);
    when(resultSet.getObject(1)).thenReturn(7, 8);
    when(resultSet.getObject(2)).thenReturn(10.5, (Object) null);

    List<Row> rows = executor.execute(ServiceIdentifier.WALLET, SQL);

    assertEquals(
        List.of(Row.of("userId", 7, "amount", 10.5), Row.of("userId", 8, "amount", null)), rows);
    verify(resultSet).close();
    verify(statement).close();
  }

  @Test
  void driver_error_becomes_sql_execution_exception() throws SQLException {
    SQLException cause = new SQLException("relation \"Transaction\" does not exist");
    when(statement.executeQuery(SQL)).thenThrow(cause);

    SqlExecutionException exception =
        assertThrows(
            SqlExecutionException.class, () -> executor.execute(ServiceIdentifier.WALLET, SQL));

    assertEquals(ServiceIdentifier.WALLET, exception.getService());
    assertSame(cause, exception.getCause());
    assertEquals(
        "Query on service wallet failed: relation \"Transaction\" does not exist",
        exception.getMessage());
  }
}
