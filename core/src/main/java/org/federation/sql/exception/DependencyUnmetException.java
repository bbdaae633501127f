/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.exception;

import java.util.List;
import lombok.Getter;

/** A step was reached before all of its dependencies succeeded. */
public class DependencyUnmetException extends QueryExecutionException {

  @Getter private final String stepId;

  @Getter private final List<String> missing;

  public DependencyUnmetException(String stepId, List<String> missing) {
    super(
        "Dependencies not met for step " + stepId + ". Missing: " + String.join(", ", missing));
    this.stepId = stepId;
    this.missing = List.copyOf(missing);
  }
}
