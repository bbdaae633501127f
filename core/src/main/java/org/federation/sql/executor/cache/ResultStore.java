/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.cache;

import java.util.List;
import org.federation.sql.data.model.Row;

/**
 * Best-effort store of intermediate step results, keyed by {@code <planId>:<stepId>}. The store is
 * never authoritative: a miss reads as an empty result.
 */
public interface ResultStore {

  void connect();

  void disconnect();

  boolean isConnected();

  void store(String key, List<Row> rows);

  /** Rows stored under the key, empty on a miss or failure. */
  List<Row> get(String key);

  boolean exists(String key);

  /** Remove every entry of the given plan. */
  void clear(String planId);

  static String key(String planId, String stepId) {
    return planId + ":" + stepId;
  }
}
