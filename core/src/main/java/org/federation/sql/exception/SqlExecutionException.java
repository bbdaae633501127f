/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.exception;

import lombok.Getter;
import org.federation.sql.catalog.model.ServiceIdentifier;

/** The service rejected or failed to run a statement. */
public class SqlExecutionException extends QueryExecutionException {

  @Getter private final ServiceIdentifier service;

  public SqlExecutionException(ServiceIdentifier service, String message, Throwable cause) {
    super("Query on service " + service + " failed: " + message, cause);
    this.service = service;
  }

  public SqlExecutionException(ServiceIdentifier service, String message) {
    super("Query on service " + service + " failed: " + message);
    this.service = service;
  }
}
