/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor;

import java.util.List;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.data.model.Row;

/** Runs SQL against one service. Implementations own their timeouts and connection retries. */
public interface SqlExecutor {

  /**
   * Execute a statement.
   *
   * @param service target service
   * @param sql statement with every placeholder already substituted
   * @return result rows in result-set order
   * @throws org.federation.sql.exception.SqlExecutionException when the service fails the query
   */
  List<Row> execute(ServiceIdentifier service, String sql);
}
