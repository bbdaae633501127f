/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.exception;

import lombok.Getter;

public class CyclicDependencyException extends QueryExecutionException {

  @Getter private final String stepId;

  public CyclicDependencyException(String stepId) {
    super("Circular dependency detected for step " + stepId);
    this.stepId = stepId;
  }
}
