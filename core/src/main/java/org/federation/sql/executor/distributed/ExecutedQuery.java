/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import org.federation.sql.catalog.model.ServiceIdentifier;

/** SQL text sent to a service on behalf of a step, after normalization and substitution. */
public record ExecutedQuery(String stepId, ServiceIdentifier service, String sql) {

  /** Rendering used when reporting executed SQL: a service comment line followed by the SQL. */
  public String format() {
    return String.format("/* %s */\n%s", service.getServiceName(), sql);
  }
}
