/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.conflict;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of checking a plan for shared table names.
 *
 * @param conflicts one entry per shared table the plan references
 * @param errorProbability risk classification
 * @param suggestedResolution advice for the drafter, null when there is no conflict
 */
public record ConflictDetectionResult(
    List<TableConflict> conflicts, ErrorProbability errorProbability, String suggestedResolution) {

  public static ConflictDetectionResult none() {
    return new ConflictDetectionResult(List.of(), ErrorProbability.LOW, null);
  }

  public boolean hasConflicts() {
    return !conflicts.isEmpty();
  }

  public Optional<String> suggestion() {
    return Optional.ofNullable(suggestedResolution);
  }
}
