/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.common.setting.Settings;
import org.federation.sql.planner.distributed.DistributedQueryPlan;
import org.federation.sql.planner.distributed.InMemoryOperation;
import org.federation.sql.planner.distributed.PlanStep;
import org.federation.sql.planner.distributed.QueryPlan;
import org.federation.sql.planner.distributed.QueryStep;

/**
 * Turns a flat per-service plan into a dependency graph.
 *
 * <p>Every step with SQL becomes a leaf {@code step_<n>}, n being its position in the flat plan. A
 * parameterized leaf depends on the leaf right before it; parameters sourced from steps further
 * back are not traced. When there is more than one leaf, synthetic in-memory steps chosen by
 * {@link QueryIntentClassifier} combine the leaves and the last of them becomes the final step.
 */
@Log4j2
public class DistributedPlanBuilder {

  private static final Pattern TRANSACTION_SUBQUERY =
      Pattern.compile(
          "WHERE\\s+id\\s*=\\s*\\(\\s*SELECT\\s+.+?\\s+FROM\\s+\"?Transaction\"?.+?\\)",
          Pattern.CASE_INSENSITIVE);

  private static final String USER_BY_ID = "SELECT * FROM \"User\" WHERE id = $1";

  private final String joinKey;

  private final int topLimit;

  public DistributedPlanBuilder() {
    this(
        Settings.Key.JOIN_KEY.getDefaultValue(),
        Integer.parseInt(Settings.Key.TOP_LIMIT.getDefaultValue()));
  }

  public DistributedPlanBuilder(Settings settings) {
    this(
        settings.<String>getSettingValue(Settings.Key.JOIN_KEY),
        settings.<Integer>getSettingValue(Settings.Key.TOP_LIMIT));
  }

  public DistributedPlanBuilder(String joinKey, int topLimit) {
    this.joinKey = joinKey;
    this.topLimit = topLimit;
  }

  /**
   * Build the distributed plan for a flat plan.
   *
   * @param plan flat plan drafted for the question
   * @param question natural-language question, used to pick the aggregation strategy
   * @return plan with a fresh random id
   * @throws IllegalArgumentException when no step carries SQL
   */
  public DistributedQueryPlan build(QueryPlan plan, String question) {
    List<PlanStep> planSteps = plan.getSteps();
    log.info(
        "Converting flat plan with {} steps over services {} into distributed plan",
        planSteps.size(),
        plan.getRequiredServices());

    List<QueryStep> leaves = new ArrayList<>();
    for (int i = 0; i < planSteps.size(); i++) {
      PlanStep planStep = planSteps.get(i);
      if (!planStep.hasSql()) {
        log.debug("Skipping step {} without SQL", i + 1);
        continue;
      }
      QueryStep leaf =
          QueryStep.sql(
              "step_" + (i + 1), planStep.service(), planStep.description(), planStep.sqlQuery());
      leaf.setParameters(ParameterDetector.detect(planStep.sqlQuery()));
      log.info(
          "Created step {} for service {} with parameters {}",
          leaf.getId(),
          leaf.getService(),
          leaf.getParameters());
      leaves.add(leaf);
    }
    if (leaves.isEmpty()) {
      throw new IllegalArgumentException("Plan contains no step with a SQL query");
    }

    linkDependencies(leaves);

    List<QueryStep> steps = new ArrayList<>(leaves);
    List<String> leafIds = leaves.stream().map(QueryStep::getId).collect(Collectors.toList());
    String finalStepId =
        leaves.size() == 1 ? leafIds.get(0) : appendAggregationSteps(steps, leafIds, question);

    DistributedQueryPlan distributedPlan =
        DistributedQueryPlan.create(steps, plan.getRequiredServices(), finalStepId);
    log.info("Built {}", distributedPlan);
    return distributedPlan;
  }

  private void linkDependencies(List<QueryStep> leaves) {
    for (int i = 1; i < leaves.size(); i++) {
      QueryStep current = leaves.get(i);
      if (!current.getParameters().isEmpty()) {
        String previousId = leaves.get(i - 1).getId();
        log.info(
            "Step {} has parameters {}, depends on {}",
            current.getId(),
            current.getParameters(),
            previousId);
        current.getDependsOn().add(previousId);
      }
      if (i == 1 && isUserByTransactionSubquery(leaves.get(0), current)) {
        rewriteUserLookup(leaves.get(0), current);
      }
    }
  }

  /** A pam step selecting users by a subquery into wallet's transactions. */
  private static boolean isUserByTransactionSubquery(QueryStep first, QueryStep current) {
    String sql = current.getSqlQuery();
    return first.getService() == ServiceIdentifier.WALLET
        && current.getService() == ServiceIdentifier.PAM
        && sql.contains("Transaction")
        && sql.contains("User");
  }

  /** pam cannot run a subquery into wallet, so the user id comes from the first step instead. */
  private static void rewriteUserLookup(QueryStep first, QueryStep current) {
    String sql = current.getSqlQuery();
    String rewritten;
    if (sql.contains("ORDER BY") && sql.endsWith(")")) {
      rewritten = USER_BY_ID;
    } else {
      rewritten =
          TRANSACTION_SUBQUERY
              .matcher(sql)
              .replaceFirst(Matcher.quoteReplacement("WHERE id = $1"));
    }
    log.info(
        "Rewrote step {} to read the user id from {}: {}",
        current.getId(),
        first.getId(),
        rewritten);
    current.setSqlQuery(rewritten);
    current.setParameters(new ArrayList<>(List.of(ParameterDetector.USER_ID)));
    current.setDependsOn(new ArrayList<>(List.of(first.getId())));
  }

  private String appendAggregationSteps(
      List<QueryStep> steps, List<String> leafIds, String question) {
    AggregationStrategy strategy = QueryIntentClassifier.classify(question);
    log.info("Combining {} leaf steps with strategy {}", leafIds.size(), strategy);
    switch (strategy) {
      case COUNT:
        return appendCount(steps, leafIds);
      case MAX:
        return appendMax(steps, leafIds, QueryIntentClassifier.maxFields(question));
      case SORT_LIMIT:
        return appendSortLimit(
            steps,
            leafIds,
            QueryIntentClassifier.sortFields(question),
            QueryIntentClassifier.isDescending(question));
      default:
        return appendJoinFold(steps, leafIds);
    }
  }

  private String appendCount(List<QueryStep> steps, List<String> leafIds) {
    QueryStep count =
        QueryStep.inMemory(
            "aggregate_count",
            "Aggregate count results from all services",
            InMemoryOperation.AGGREGATE,
            leafIds,
            List.of("count", "*"));
    steps.add(count);
    return count.getId();
  }

  private String appendMax(List<QueryStep> steps, List<String> leafIds, List<String> fields) {
    List<String> maxStepIds = new ArrayList<>();
    for (int i = 0; i < leafIds.size(); i++) {
      String leafId = leafIds.get(i);
      for (String field : fields) {
        QueryStep max =
            QueryStep.inMemory(
                "max_" + field + "_" + (i + 1),
                "Find maximum " + field + " in results from step " + leafId,
                InMemoryOperation.AGGREGATE,
                List.of(leafId),
                List.of("max", field));
        steps.add(max);
        maxStepIds.add(max.getId());
        log.debug("Added max aggregation step {}", max.getId());
      }
    }
    QueryStep globalMax =
        QueryStep.inMemory(
            "global_max",
            "Find global maximum from all services",
            InMemoryOperation.AGGREGATE,
            maxStepIds,
            List.of("max", "max"));
    steps.add(globalMax);

    List<String> filterInputs = new ArrayList<>(leafIds);
    filterInputs.add(globalMax.getId());
    QueryStep filter =
        QueryStep.inMemory(
            "filter_by_max",
            "Filter results to find records with maximum value",
            InMemoryOperation.FILTER,
            filterInputs,
            List.of(fields.get(0), "=", "${max}"));
    steps.add(filter);
    return filter.getId();
  }

  private String appendSortLimit(
      List<QueryStep> steps, List<String> leafIds, List<String> fields, boolean descending) {
    QueryStep join =
        QueryStep.inMemory(
            "join_all",
            "Combine results from all services",
            InMemoryOperation.JOIN,
            leafIds,
            List.of(joinKey));
    steps.add(join);

    String direction = descending ? "desc" : "asc";
    String currentId = join.getId();
    for (String field : fields) {
      QueryStep sort =
          QueryStep.inMemory(
              "sort_by_" + field,
              "Sort results by " + field + " " + direction,
              InMemoryOperation.SORT,
              List.of(currentId),
              List.of(field, direction));
      steps.add(sort);
      currentId = sort.getId();
      log.debug("Added sort step {}", currentId);
    }

    QueryStep limit =
        QueryStep.inMemory(
            "limit_" + fields.get(0),
            "Take top " + topLimit + " rows from " + currentId,
            InMemoryOperation.LIMIT,
            List.of(currentId),
            List.of(String.valueOf(topLimit)));
    steps.add(limit);
    return limit.getId();
  }

  private String appendJoinFold(List<QueryStep> steps, List<String> leafIds) {
    String currentId = leafIds.get(0);
    for (int i = 1; i < leafIds.size(); i++) {
      QueryStep join =
          QueryStep.inMemory(
              "join_" + i,
              "Join results from step " + currentId + " and " + leafIds.get(i),
              InMemoryOperation.JOIN,
              List.of(currentId, leafIds.get(i)),
              List.of(joinKey));
      steps.add(join);
      currentId = join.getId();
      log.debug("Added join step {}", currentId);
    }
    return currentId;
  }
}
