/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.federation.sql.data.model.Row;

/** Outcome of running a distributed plan. */
@Data
@NoArgsConstructor
public class ExecutionResult {

  /** Key of {@link #errors} holding a failure that aborted the whole plan. */
  public static final String GLOBAL_ERROR_KEY = "global";

  private String planId;

  private ExecutionState state = ExecutionState.INITIALIZING;

  /** Rows of the final step. */
  private List<Row> finalResults = new ArrayList<>();

  /** Rows of every successful step, by step id. */
  private Map<String, List<Row>> intermediateResults = new LinkedHashMap<>();

  /** Ids of successful steps in execution order. */
  private List<String> executedSteps = new ArrayList<>();

  /** Error message by step id, or by {@link #GLOBAL_ERROR_KEY}. */
  private Map<String, String> errors = new LinkedHashMap<>();

  private List<ExecutedQuery> executedQueries = new ArrayList<>();

  public static ExecutionResult initializing(String planId) {
    ExecutionResult result = new ExecutionResult();
    result.setPlanId(planId);
    return result;
  }

  /** Result of a plan rejected before any step ran. */
  public static ExecutionResult failed(String planId, String error) {
    ExecutionResult result = initializing(planId);
    result.setState(ExecutionState.FAILED);
    result.getErrors().put(GLOBAL_ERROR_KEY, error);
    return result;
  }

  public void recordStep(String stepId, List<Row> rows) {
    intermediateResults.put(stepId, rows);
    executedSteps.add(stepId);
  }

  public void recordError(String key, String message) {
    errors.put(key, message);
  }

  public Optional<String> getGlobalError() {
    return Optional.ofNullable(errors.get(GLOBAL_ERROR_KEY));
  }

  public boolean isSuccessful() {
    return state == ExecutionState.COMPLETED && !errors.containsKey(GLOBAL_ERROR_KEY);
  }

  /** Executed SQL, each prefixed with a comment naming its service. */
  public List<String> getFormattedQueries() {
    return executedQueries.stream().map(ExecutedQuery::format).collect(Collectors.toList());
  }
}
