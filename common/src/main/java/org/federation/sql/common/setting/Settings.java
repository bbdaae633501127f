/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.common.setting;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Federation settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Result store. */
    CACHE_TTL_MINUTES("federation.cache.ttl.minutes", Long.class, "30"),
    CACHE_KEY_PREFIX("federation.cache.key.prefix", String.class, "sql-query-result:"),

    /** Schema catalog. */
    CATALOG_PATH("federation.catalog.path", String.class, ""),

    /** Synthetic step construction. */
    JOIN_KEY("federation.join.key", String.class, "id"),
    TOP_LIMIT("federation.limit.top", Integer.class, "3"),

    /** JDBC connection handling. */
    JDBC_CONNECT_MAX_ATTEMPTS("federation.jdbc.connect.max.attempts", Integer.class, "3"),
    JDBC_CONNECT_BACKOFF_MILLIS("federation.jdbc.connect.backoff.millis", Long.class, "1000"),
    JDBC_VALIDATION_TIMEOUT_SECONDS(
        "federation.jdbc.validation.timeout.seconds", Integer.class, "5");

    @Getter private final String keyValue;

    @Getter private final Class<?> valueType;

    @Getter private final String defaultValue;

    public static Optional<Key> of(String keyValue) {
      return Arrays.stream(Key.values())
          .filter(key -> key.keyValue.equalsIgnoreCase(keyValue))
          .findFirst();
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  /** Raw value of an arbitrary, not predeclared key such as a per-service datasource url. */
  public abstract Optional<String> getRawValue(String keyValue);
}
