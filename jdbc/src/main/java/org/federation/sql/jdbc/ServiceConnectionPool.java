/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.jdbc;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.common.setting.Settings;
import org.federation.sql.exception.SqlExecutionException;

/**
 * Holds one JDBC connection per service, opened lazily from the datasource settings {@code
 * federation.datasource.<service>.url|username|password}. Opening a connection is retried with
 * exponential random backoff; a connection that no longer validates is replaced. Statements run
 * through {@link #withConnection} so that one service's connection serves one caller at a time.
 */
@Log4j2
public class ServiceConnectionPool implements AutoCloseable {

  static final String DATASOURCE_PREFIX = "federation.datasource.";

  /** Opens a physical connection. */
  @FunctionalInterface
  public interface ConnectionFactory {
    Connection connect(String url, String username, String password) throws SQLException;
  }

  /** Work done while holding a service's connection. */
  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T apply(Connection connection) throws SQLException;
  }

  public enum ConnectionStatus {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    ERROR
  }

  /** Connection statistics of one service. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ConnectionStats {
    private int connectAttempts;
    private int failedAttempts;
    private int queries;
    private String lastError;
  }

  private final Settings settings;
  private final ConnectionFactory connectionFactory;
  private final Retry retry;
  private final int validationTimeoutSeconds;

  private final Map<ServiceIdentifier, Connection> connections =
      new EnumMap<>(ServiceIdentifier.class);
  private final Map<ServiceIdentifier, ConnectionStatus> statuses =
      new EnumMap<>(ServiceIdentifier.class);
  private final Map<ServiceIdentifier, ConnectionStats> stats =
      new EnumMap<>(ServiceIdentifier.class);
  private final Map<ServiceIdentifier, Lock> serviceLocks = new ConcurrentHashMap<>();

  public ServiceConnectionPool(Settings settings) {
    this(settings, DriverManager::getConnection);
  }

  public ServiceConnectionPool(Settings settings, ConnectionFactory connectionFactory) {
    this.settings = settings;
    this.connectionFactory = connectionFactory;
    this.validationTimeoutSeconds =
        settings.<Integer>getSettingValue(Settings.Key.JDBC_VALIDATION_TIMEOUT_SECONDS);
    long backoffMillis = settings.<Long>getSettingValue(Settings.Key.JDBC_CONNECT_BACKOFF_MILLIS);
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(settings.<Integer>getSettingValue(Settings.Key.JDBC_CONNECT_MAX_ATTEMPTS))
            .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(backoffMillis))
            .retryExceptions(SqlExecutionException.class)
            .build();
    this.retry = Retry.of("jdbc-connect", config);
  }

  /**
   * Run work on a service's connection, holding it exclusively until the work returns.
   *
   * @throws SqlExecutionException when no connection can be opened
   * @throws SQLException when the work fails
   */
  public <T> T withConnection(ServiceIdentifier service, ConnectionCallback<T> callback)
      throws SQLException {
    Lock lock = serviceLocks.computeIfAbsent(service, key -> new ReentrantLock());
    lock.lock();
    try {
      return callback.apply(getConnection(service));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Connection to a service, opened on first use.
   *
   * @throws SqlExecutionException when the service has no datasource settings or every
   *     connection attempt failed
   */
  public synchronized Connection getConnection(ServiceIdentifier service) {
    Connection existing = connections.get(service);
    if (existing != null && isValid(service, existing)) {
      stats(service).setQueries(stats(service).getQueries() + 1);
      return existing;
    }
    if (existing != null) {
      log.warn("Connection to service {} is no longer valid, reconnecting", service);
      closeQuietly(service, existing);
      connections.remove(service);
    }

    String url =
        setting(service, "url")
            .orElseThrow(
                () ->
                    new SqlExecutionException(
                        service, "No datasource url configured for service " + service));
    String username = setting(service, "username").orElse(null);
    String password = setting(service, "password").orElse(null);

    statuses.put(service, ConnectionStatus.CONNECTING);
    Supplier<Connection> connect =
        Retry.decorateSupplier(retry, () -> open(service, url, username, password));
    try {
      Connection connection = connect.get();
      connections.put(service, connection);
      statuses.put(service, ConnectionStatus.CONNECTED);
      stats(service).setQueries(stats(service).getQueries() + 1);
      log.info("Connected to service {}", service);
      return connection;
    } catch (SqlExecutionException e) {
      statuses.put(service, ConnectionStatus.ERROR);
      log.error("Unable to connect to service {}: {}", service, e.getMessage());
      throw e;
    }
  }

  public synchronized ConnectionStatus getStatus(ServiceIdentifier service) {
    return statuses.getOrDefault(service, ConnectionStatus.DISCONNECTED);
  }

  public synchronized Map<ServiceIdentifier, ConnectionStats> getStats() {
    Map<ServiceIdentifier, ConnectionStats> copy = new EnumMap<>(ServiceIdentifier.class);
    stats.forEach(
        (service, value) ->
            copy.put(
                service,
                new ConnectionStats(
                    value.getConnectAttempts(),
                    value.getFailedAttempts(),
                    value.getQueries(),
                    value.getLastError())));
    return copy;
  }

  /** Close the connection of a service. */
  public synchronized void release(ServiceIdentifier service) {
    Connection connection = connections.remove(service);
    if (connection != null) {
      closeQuietly(service, connection);
    }
    statuses.put(service, ConnectionStatus.DISCONNECTED);
  }

  @Override
  public synchronized void close() {
    for (Map.Entry<ServiceIdentifier, Connection> entry : connections.entrySet()) {
      closeQuietly(entry.getKey(), entry.getValue());
      statuses.put(entry.getKey(), ConnectionStatus.DISCONNECTED);
    }
    connections.clear();
    log.info("Closed all service connections");
  }

  private Connection open(
      ServiceIdentifier service, String url, String username, String password) {
    ConnectionStats serviceStats = stats(service);
    serviceStats.setConnectAttempts(serviceStats.getConnectAttempts() + 1);
    try {
      return connectionFactory.connect(url, username, password);
    } catch (SQLException e) {
      serviceStats.setFailedAttempts(serviceStats.getFailedAttempts() + 1);
      serviceStats.setLastError(e.getMessage());
      log.warn("Connection attempt to service {} failed: {}", service, e.getMessage());
      throw new SqlExecutionException(service, e.getMessage(), e);
    }
  }

  private boolean isValid(ServiceIdentifier service, Connection connection) {
    try {
      return connection.isValid(validationTimeoutSeconds);
    } catch (SQLException e) {
      log.warn("Validation of connection to service {} failed: {}", service, e.getMessage());
      return false;
    }
  }

  private void closeQuietly(ServiceIdentifier service, Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to close connection to service {}: {}", service, e.getMessage());
    }
  }

  private Optional<String> setting(ServiceIdentifier service, String property) {
    return settings.getRawValue(DATASOURCE_PREFIX + service.getServiceName() + "." + property);
  }

  private ConnectionStats stats(ServiceIdentifier service) {
    return stats.computeIfAbsent(service, key -> new ConnectionStats());
  }
}
