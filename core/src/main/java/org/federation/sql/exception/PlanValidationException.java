/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.exception;

import java.util.List;
import lombok.Getter;

/** The plan is malformed or crosses a service boundary; no step was executed. */
public class PlanValidationException extends QueryExecutionException {

  @Getter private final List<String> errors;

  public PlanValidationException(String message) {
    super(message);
    this.errors = List.of(message);
  }

  public PlanValidationException(List<String> errors) {
    super("Plan validation failed: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
  }
}
