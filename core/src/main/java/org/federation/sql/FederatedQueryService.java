/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql;

import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.SchemaCatalog;
import org.federation.sql.common.setting.Settings;
import org.federation.sql.conflict.ConflictDetectionResult;
import org.federation.sql.conflict.ConflictDetector;
import org.federation.sql.conflict.ErrorProbability;
import org.federation.sql.exception.QueryExecutionException;
import org.federation.sql.executor.SqlExecutor;
import org.federation.sql.executor.cache.ResultStore;
import org.federation.sql.executor.distributed.DistributedQueryProcessor;
import org.federation.sql.executor.distributed.ExecutionResult;
import org.federation.sql.planner.distributed.DistributedQueryPlan;
import org.federation.sql.planner.distributed.QueryPlan;
import org.federation.sql.planner.distributed.builder.DistributedPlanBuilder;

/** Entry point answering a question from a flat per-service SQL plan. */
@Log4j2
public class FederatedQueryService {

  private final ConflictDetector conflictDetector;
  private final DistributedPlanBuilder planBuilder;
  private final DistributedQueryProcessor processor;

  public FederatedQueryService(
      SchemaCatalog catalog, SqlExecutor sqlExecutor, ResultStore resultStore, Settings settings) {
    this(
        new ConflictDetector(catalog),
        new DistributedPlanBuilder(settings),
        new DistributedQueryProcessor(sqlExecutor, resultStore, catalog));
  }

  public FederatedQueryService(
      ConflictDetector conflictDetector,
      DistributedPlanBuilder planBuilder,
      DistributedQueryProcessor processor) {
    this.conflictDetector = conflictDetector;
    this.planBuilder = planBuilder;
    this.processor = processor;
  }

  /**
   * Execute a flat plan.
   *
   * @param plan per-service SQL steps drafted for the question
   * @param question natural-language question
   * @return execution result; a plan rejected before execution yields a failed result with a
   *     global error
   */
  public ExecutionResult execute(QueryPlan plan, String question) {
    ConflictDetectionResult conflicts = conflictDetector.detectPlanConflicts(plan);
    if (conflicts.errorProbability() != ErrorProbability.LOW) {
      log.warn(
          "Table conflicts with {} error probability: {}",
          conflicts.errorProbability(),
          conflicts.suggestion().orElse(""));
    }

    DistributedQueryPlan distributedPlan;
    try {
      distributedPlan = planBuilder.build(plan, question);
    } catch (IllegalArgumentException e) {
      log.error("Unable to build distributed plan: {}", e.getMessage());
      return ExecutionResult.failed(null, e.getMessage());
    }

    try {
      ExecutionResult result = processor.executeDistributedPlan(distributedPlan);
      log.info(
          "Executed queries of plan {}:\n{}",
          distributedPlan.getId(),
          String.join("\n\n", result.getFormattedQueries()));
      return result;
    } catch (QueryExecutionException e) {
      log.error("Distributed plan {} rejected: {}", distributedPlan.getId(), e.getMessage());
      distributedPlan.markFailed(e.getMessage());
      return ExecutionResult.failed(distributedPlan.getId(), e.getMessage());
    }
  }
}
