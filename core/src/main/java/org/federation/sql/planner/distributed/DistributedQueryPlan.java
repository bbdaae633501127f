/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.federation.sql.catalog.model.ServiceIdentifier;

/**
 * Dependency graph of steps answering one question.
 *
 * <p>Example for a question touching two services:
 *
 * <pre>
 * step_1 (wallet, SQL) ──┐
 *                        ├──> join_1 (JOIN on id, in memory)  = final step
 * step_2 (pam, SQL) ─────┘
 * </pre>
 *
 * <p>A plan is built once per question and executed once; its cached step results are cleared
 * before a run and otherwise expire.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class DistributedQueryPlan {

  /** Unique identifier, also the namespace of cached step results */
  private String id;

  private List<QueryStep> steps = new ArrayList<>();

  private Set<ServiceIdentifier> requiredServices = new LinkedHashSet<>();

  /** Step whose rows are the answer */
  private String finalStepId;

  private PlanStatus status = PlanStatus.CREATED;

  /** Error of a failed run */
  private String error;

  /** Enumeration of plan execution status. */
  public enum PlanStatus {
    /** Plan is built but not yet started */
    CREATED,

    /** Plan is currently executing */
    EXECUTING,

    /** Plan completed successfully */
    COMPLETED,

    /** Plan failed during execution */
    FAILED
  }

  /**
   * Creates a plan with a random id.
   *
   * @param steps steps of the graph
   * @param requiredServices services the plan touches
   * @param finalStepId id of the step producing the answer
   * @return plan in {@link PlanStatus#CREATED} state
   */
  public static DistributedQueryPlan create(
      List<QueryStep> steps, Set<ServiceIdentifier> requiredServices, String finalStepId) {
    return new DistributedQueryPlan(
        UUID.randomUUID().toString(),
        new ArrayList<>(steps),
        new LinkedHashSet<>(requiredServices),
        finalStepId,
        PlanStatus.CREATED,
        null);
  }

  public Optional<QueryStep> getStep(String stepId) {
    return steps.stream().filter(step -> stepId.equals(step.getId())).findFirst();
  }

  /**
   * A step is critical when its failure must abort the run: it is the final step or another step
   * depends on it.
   */
  public boolean isStepCritical(String stepId) {
    if (stepId.equals(finalStepId)) {
      return true;
    }
    return steps.stream()
        .anyMatch(step -> step.getDependsOn() != null && step.getDependsOn().contains(stepId));
  }

  /** Marks the plan as executing. */
  public void markExecuting() {
    if (status == PlanStatus.CREATED) {
      status = PlanStatus.EXECUTING;
    }
  }

  /** Marks the plan as completed. */
  public void markCompleted() {
    if (status == PlanStatus.EXECUTING) {
      status = PlanStatus.COMPLETED;
    }
  }

  /**
   * Marks the plan as failed.
   *
   * @param error Error information
   */
  public void markFailed(String error) {
    this.status = PlanStatus.FAILED;
    this.error = error;
  }

  /**
   * Validates the plan structure and dependencies. Cycles are detected when the plan is ordered for
   * execution.
   *
   * @return List of validation errors (empty if valid)
   */
  public List<String> validate() {
    List<String> errors = new ArrayList<>();

    if (steps == null || steps.isEmpty()) {
      errors.add("Plan must contain at least one step");
      return errors;
    }

    Set<String> stepIds = new HashSet<>();
    for (QueryStep step : steps) {
      if (!stepIds.add(step.getId())) {
        errors.add("Plan contains duplicate step ID: " + step.getId());
      }
    }

    for (QueryStep step : steps) {
      if (step.getDependsOn() != null) {
        for (String dependency : step.getDependsOn()) {
          if (!stepIds.contains(dependency)) {
            errors.add("Step " + step.getId() + " depends on non-existent step: " + dependency);
          }
        }
      }
      if (step.isInMemory() && step.hasSql()) {
        errors.add("In-memory step " + step.getId() + " must not carry SQL");
      }
      if (step.isInMemory() && step.getOperation() == null) {
        errors.add("In-memory step " + step.getId() + " has no operation");
      }
      if (!step.isInMemory() && !step.hasSql()) {
        errors.add("Step " + step.getId() + " has neither SQL nor an in-memory operation");
      }
    }

    if (finalStepId == null || !stepIds.contains(finalStepId)) {
      errors.add("Final step " + finalStepId + " is not part of the plan");
    }
    return errors;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("DistributedQueryPlan{")
        .append("id='")
        .append(id)
        .append('\'')
        .append(", steps=")
        .append(steps != null ? steps.size() : 0)
        .append(", finalStepId='")
        .append(finalStepId)
        .append('\'')
        .append(", status=")
        .append(status)
        .append('}');
    return sb.toString();
  }
}
