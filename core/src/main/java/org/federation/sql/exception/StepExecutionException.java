/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.exception;

import lombok.Getter;

/** A SQL or in-memory step failed. */
public class StepExecutionException extends QueryExecutionException {

  @Getter private final String stepId;

  public StepExecutionException(String stepId, String message) {
    super(message);
    this.stepId = stepId;
  }

  public StepExecutionException(String stepId, String message, Throwable cause) {
    super(message, cause);
    this.stepId = stepId;
  }
}
