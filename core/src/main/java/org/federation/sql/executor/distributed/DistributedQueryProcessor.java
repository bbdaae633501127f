/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.SchemaCatalog;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.data.model.Row;
import org.federation.sql.exception.DependencyUnmetException;
import org.federation.sql.exception.PlanValidationException;
import org.federation.sql.exception.StepExecutionException;
import org.federation.sql.executor.SqlExecutor;
import org.federation.sql.executor.cache.ResultStore;
import org.federation.sql.planner.distributed.DistributedQueryPlan;
import org.federation.sql.planner.distributed.QueryStep;

/**
 * Runs a distributed plan step by step in dependency order.
 *
 * <p><strong>Execution Flow:</strong>
 *
 * <pre>
 * 1. Connect the result store and clear entries left by an earlier run of the plan
 * 2. Validate plan structure and service boundaries, order the steps
 * 3. SQL steps: quote userId, check and repair against the schema, substitute parameters, run
 * 4. In-memory steps: evaluate the operator over the dependencies' cached rows
 * 5. Store every step's rows under planId:stepId and read the final step's rows back
 * </pre>
 *
 * <p>Failure of a critical step aborts the run. Failure of any other step is recorded and the run
 * continues.
 */
@Log4j2
public class DistributedQueryProcessor {

  static final String PLAN_ERROR_PREFIX = "Error executing distributed query plan: ";

  private final SqlExecutor sqlExecutor;
  private final ResultStore resultStore;
  private final SqlSchemaValidator schemaValidator;
  private final ServiceBoundaryValidator boundaryValidator;
  private final InMemoryStepExecutor inMemoryStepExecutor;

  public DistributedQueryProcessor(
      SqlExecutor sqlExecutor, ResultStore resultStore, SchemaCatalog catalog) {
    this.sqlExecutor = sqlExecutor;
    this.resultStore = resultStore;
    this.schemaValidator = new SqlSchemaValidator(catalog);
    this.boundaryValidator = new ServiceBoundaryValidator(catalog);
    this.inMemoryStepExecutor = new InMemoryStepExecutor();
  }

  /**
   * Creates a plan over the given steps.
   *
   * @param finalStepId id of the answer step, the last step when null
   */
  public DistributedQueryPlan createPlan(
      List<QueryStep> steps, Set<ServiceIdentifier> requiredServices, String finalStepId) {
    if (steps.isEmpty()) {
      throw new IllegalArgumentException("Plan must contain at least one step");
    }
    String answer = finalStepId != null ? finalStepId : steps.get(steps.size() - 1).getId();
    return DistributedQueryPlan.create(steps, requiredServices, answer);
  }

  /**
   * Execute a plan.
   *
   * @param plan plan to run
   * @return result carrying the final rows, or the errors that stopped the run
   * @throws PlanValidationException when the plan is malformed or crosses service boundaries
   * @throws org.federation.sql.exception.CyclicDependencyException when steps depend on each
   *     other in a cycle
   */
  public ExecutionResult executeDistributedPlan(DistributedQueryPlan plan) {
    log.info("Starting execution of distributed plan: {}", plan.getId());
    ExecutionResult result = ExecutionResult.initializing(plan.getId());
    prepareStore(plan.getId());

    List<String> validationErrors = plan.validate();
    if (!validationErrors.isEmpty()) {
      throw new PlanValidationException(validationErrors);
    }
    List<String> boundaryViolations = boundaryValidator.validate(plan.getSteps());
    if (!boundaryViolations.isEmpty()) {
      throw new PlanValidationException(boundaryViolations);
    }
    List<String> order = StepScheduler.topologicalSort(plan.getSteps());
    log.debug("Execution order of plan {}: {}", plan.getId(), order);
    result.setState(ExecutionState.SCHEDULED);

    plan.markExecuting();
    result.setState(ExecutionState.EXECUTING);
    try {
      Set<String> succeeded = new HashSet<>();
      for (String stepId : order) {
        QueryStep step = plan.getStep(stepId).orElseThrow();
        if (executeStep(plan, step, succeeded, result)) {
          succeeded.add(stepId);
        }
      }
      result.setFinalResults(finalRows(plan, result));
      result.setState(ExecutionState.COMPLETED);
      plan.markCompleted();
      log.info(
          "Distributed plan {} completed, {} rows in final result",
          plan.getId(),
          result.getFinalResults().size());
    } catch (RuntimeException e) {
      log.error("Failed distributed query execution: {}", plan.getId(), e);
      String message = PLAN_ERROR_PREFIX + e.getMessage();
      result.recordError(ExecutionResult.GLOBAL_ERROR_KEY, message);
      result.setState(ExecutionState.FAILED);
      plan.markFailed(message);
    }
    return result;
  }

  /**
   * Run one step.
   *
   * @return true when the step produced rows
   */
  private boolean executeStep(
      DistributedQueryPlan plan, QueryStep step, Set<String> succeeded, ExecutionResult result) {
    List<String> missing =
        step.getDependsOn().stream()
            .filter(dependency -> !succeeded.contains(dependency))
            .collect(Collectors.toList());
    if (!missing.isEmpty()) {
      throw new DependencyUnmetException(step.getId(), missing);
    }

    Map<String, List<Row>> inputs = new LinkedHashMap<>();
    for (String dependency : step.getDependsOn()) {
      inputs.put(dependency, dependencyRows(plan.getId(), dependency, result));
    }

    long startTime = System.currentTimeMillis();
    try {
      List<Row> rows =
          step.isInMemory()
              ? inMemoryStepExecutor.execute(step, inputs)
              : executeSql(step, inputs, result);
      result.recordStep(step.getId(), rows);
      storeRows(plan.getId(), step.getId(), rows);
      log.info(
          "Step {} returned {} rows in {} ms",
          step.getId(),
          rows.size(),
          System.currentTimeMillis() - startTime);
      return true;
    } catch (RuntimeException e) {
      result.recordError(step.getId(), e.getMessage());
      if (plan.isStepCritical(step.getId())) {
        log.error("Critical step {} failed: {}", step.getId(), e.getMessage());
        throw e;
      }
      log.warn("Non-critical step {} failed, continuing: {}", step.getId(), e.getMessage());
      return false;
    }
  }

  private List<Row> executeSql(
      QueryStep step, Map<String, List<Row>> inputs, ExecutionResult result) {
    String sql = IdentifierNormalizer.quoteUserId(step.getSqlQuery());
    sql = schemaValidator.validateAndRepair(step.getId(), step.getService(), sql);
    sql = ParameterSubstitutor.substitute(sql, step.getParameters(), inputs);
    log.info("Executing step {} on service {}: {}", step.getId(), step.getService(), sql);
    result.getExecutedQueries().add(new ExecutedQuery(step.getId(), step.getService(), sql));
    try {
      return sqlExecutor.execute(step.getService(), sql);
    } catch (StepExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StepExecutionException(step.getId(), e.getMessage(), e);
    }
  }

  /** Rows of a finished step from the result store, else the in-process copy. */
  private List<Row> dependencyRows(String planId, String stepId, ExecutionResult result) {
    String key = ResultStore.key(planId, stepId);
    try {
      if (resultStore.exists(key)) {
        return resultStore.get(key);
      }
      log.warn("Result of step {} missing from result store, using in-process copy", stepId);
    } catch (RuntimeException e) {
      log.warn(
          "Result store read of step {} failed, using in-process copy: {}", stepId, e.getMessage());
    }
    return result.getIntermediateResults().getOrDefault(stepId, List.of());
  }

  private void storeRows(String planId, String stepId, List<Row> rows) {
    try {
      resultStore.store(ResultStore.key(planId, stepId), rows);
    } catch (RuntimeException e) {
      log.warn("Result store write of step {} failed: {}", stepId, e.getMessage());
    }
  }

  private List<Row> finalRows(DistributedQueryPlan plan, ExecutionResult result) {
    List<Row> rows = dependencyRows(plan.getId(), plan.getFinalStepId(), result);
    return new ArrayList<>(rows);
  }

  private void prepareStore(String planId) {
    try {
      if (!resultStore.isConnected()) {
        resultStore.connect();
      }
      resultStore.clear(planId);
    } catch (RuntimeException e) {
      log.warn("Result store unavailable for plan {}: {}", planId, e.getMessage());
    }
  }
}
