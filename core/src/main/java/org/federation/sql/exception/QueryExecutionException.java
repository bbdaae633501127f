/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.exception;

/** Base of every failure raised while validating or running a distributed plan. */
public class QueryExecutionException extends RuntimeException {

  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
