/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.List;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.common.setting.Settings;
import org.federation.sql.data.model.Row;

/** In-process {@link ResultStore} whose entries expire a fixed time after they are written. */
@Log4j2
public class GuavaResultStore implements ResultStore {

  private final String keyPrefix;

  private final Cache<String, List<Row>> cache;

  private volatile boolean connected;

  public GuavaResultStore(Settings settings) {
    this(
        settings.getSettingValue(Settings.Key.CACHE_KEY_PREFIX),
        settings.<Long>getSettingValue(Settings.Key.CACHE_TTL_MINUTES),
        Ticker.systemTicker());
  }

  @VisibleForTesting
  GuavaResultStore(String keyPrefix, long ttlMinutes, Ticker ticker) {
    this.keyPrefix = keyPrefix;
    this.cache =
        CacheBuilder.newBuilder()
            .concurrencyLevel(4)
            .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
            .ticker(ticker)
            .build();
  }

  @Override
  public void connect() {
    connected = true;
    log.info("Result store connected, key prefix {}", keyPrefix);
  }

  @Override
  public void disconnect() {
    connected = false;
    cache.invalidateAll();
    log.info("Result store disconnected");
  }

  @Override
  public boolean isConnected() {
    return connected;
  }

  @Override
  public void store(String key, List<Row> rows) {
    cache.put(fullKey(key), List.copyOf(rows));
    log.debug("Stored results for key {} ({} rows)", key, rows.size());
  }

  @Override
  public List<Row> get(String key) {
    List<Row> rows = cache.getIfPresent(fullKey(key));
    if (rows == null) {
      log.debug("No data found for key {}", key);
      return List.of();
    }
    log.debug("Retrieved results for key {} ({} rows)", key, rows.size());
    return rows;
  }

  @Override
  public boolean exists(String key) {
    return cache.getIfPresent(fullKey(key)) != null;
  }

  @Override
  public void clear(String planId) {
    String planPrefix = fullKey(planId + ":");
    int before = (int) cache.size();
    cache.asMap().keySet().removeIf(key -> key.startsWith(planPrefix));
    log.debug("Cleared {} cached results for plan {}", before - cache.size(), planId);
  }

  private String fullKey(String key) {
    return keyPrefix + key;
  }
}
