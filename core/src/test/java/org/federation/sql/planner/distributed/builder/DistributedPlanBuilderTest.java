/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.planner.distributed.DistributedQueryPlan;
import org.federation.sql.planner.distributed.InMemoryOperation;
import org.federation.sql.planner.distributed.PlanStep;
import org.federation.sql.planner.distributed.QueryPlan;
import org.federation.sql.planner.distributed.QueryStep;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DistributedPlanBuilderTest {

  private static final PlanStep DEPOSITS =
      new PlanStep(
          ServiceIdentifier.WALLET,
          "Deposits",
          "SELECT \"userId\" AS id, amount FROM \"Transaction\" WHERE type = 'deposit'");

  private static final PlanStep BETS =
      new PlanStep(
          ServiceIdentifier.BETS_HISTORY,
          "Bets",
          "SELECT \"userId\" AS id, amount FROM bets");

  private final DistributedPlanBuilder builder = new DistributedPlanBuilder();

  @Test
  void default_strategy_joins_leaves_pairwise() {
    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(DEPOSITS, BETS), "Show deposits and bets per user");

    assertEquals(List.of("step_1", "step_2", "join_1"), ids(plan));
    QueryStep join = plan.getStep("join_1").orElseThrow();
    assertTrue(join.isInMemory());
    assertNull(join.getSqlQuery());
    assertEquals(ServiceIdentifier.PAM, join.getService());
    assertEquals(InMemoryOperation.JOIN, join.getOperation());
    assertEquals(List.of("step_1", "step_2"), join.getDependsOn());
    assertEquals(List.of("id"), join.getOperationArguments());
    assertEquals("join_1", plan.getFinalStepId());
    assertEquals(DistributedQueryPlan.PlanStatus.CREATED, plan.getStatus());
    assertTrue(plan.validate().isEmpty());
  }

  @Test
  void three_leaves_fold_left_to_right() {
    PlanStep users =
        new PlanStep(ServiceIdentifier.PAM, "Users", "SELECT id, username FROM \"User\"");

    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(DEPOSITS, BETS, users), "Show deposits and bets per user");

    assertEquals(
        List.of("join_1", "step_3"), plan.getStep("join_2").orElseThrow().getDependsOn());
    assertEquals("join_2", plan.getFinalStepId());
  }

  @Test
  void count_question_aggregates_all_leaves() {
    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(DEPOSITS, BETS), "How many deposits and bets were made?");

    QueryStep count = plan.getStep("aggregate_count").orElseThrow();
    assertEquals(InMemoryOperation.AGGREGATE, count.getOperation());
    assertEquals(List.of("step_1", "step_2"), count.getDependsOn());
    assertEquals(List.of("count", "*"), count.getOperationArguments());
    assertEquals("aggregate_count", plan.getFinalStepId());
  }

  @Test
  void russian_count_question_is_recognized() {
    DistributedQueryPlan plan = builder.build(QueryPlan.of(DEPOSITS, BETS), "Сколько ставок?");

    assertEquals("aggregate_count", plan.getFinalStepId());
  }

  @Test
  void maximum_question_builds_per_leaf_and_global_maximum() {
    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(DEPOSITS, BETS), "Who made the biggest deposit?");

    assertEquals(
        List.of("step_1", "step_2", "max_amount_1", "max_amount_2", "global_max", "filter_by_max"),
        ids(plan));
    assertEquals(
        List.of("max", "amount"),
        plan.getStep("max_amount_2").orElseThrow().getOperationArguments());
    QueryStep globalMax = plan.getStep("global_max").orElseThrow();
    assertEquals(List.of("max_amount_1", "max_amount_2"), globalMax.getDependsOn());
    assertEquals(List.of("max", "max"), globalMax.getOperationArguments());
    QueryStep filter = plan.getStep("filter_by_max").orElseThrow();
    assertEquals(List.of("step_1", "step_2", "global_max"), filter.getDependsOn());
    assertEquals(List.of("amount", "=", "${max}"), filter.getOperationArguments());
    assertEquals("filter_by_max", plan.getFinalStepId());
  }

  @Test
  void top_question_joins_sorts_and_limits() {
    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(DEPOSITS, BETS), "Top deposits by amount, smallest first");

    assertEquals(
        List.of("step_1", "step_2", "join_all", "sort_by_amount", "limit_amount"), ids(plan));
    assertEquals(
        List.of("amount", "asc"),
        plan.getStep("sort_by_amount").orElseThrow().getOperationArguments());
    QueryStep limit = plan.getStep("limit_amount").orElseThrow();
    assertEquals(List.of("sort_by_amount"), limit.getDependsOn());
    assertEquals(List.of("3"), limit.getOperationArguments());
  }

  @Test
  void single_leaf_needs_no_synthetic_steps() {
    DistributedQueryPlan plan = builder.build(QueryPlan.of(BETS), "How many bets?");

    assertEquals(List.of("step_1"), ids(plan));
    assertEquals("step_1", plan.getFinalStepId());
  }

  @Test
  void steps_without_sql_are_skipped_but_keep_their_number() {
    PlanStep empty = new PlanStep(ServiceIdentifier.KYC, "Nothing to query", null);

    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(empty, DEPOSITS, BETS), "Show deposits and bets per user");

    assertEquals(List.of("step_2", "step_3", "join_1"), ids(plan));
  }

  @Test
  void plan_without_sql_is_rejected() {
    PlanStep empty = new PlanStep(ServiceIdentifier.KYC, "Nothing to query", " ");

    assertThrows(IllegalArgumentException.class, () -> builder.build(QueryPlan.of(empty), "q"));
  }

  @Test
  void parameterized_leaf_depends_on_previous_leaf() {
    PlanStep userBets =
        new PlanStep(
            ServiceIdentifier.BETS_HISTORY,
            "Bets of the user",
            "SELECT id, amount FROM bets WHERE \"userId\" = :userId");

    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(DEPOSITS, userBets), "Show deposits and bets per user");

    QueryStep leaf = plan.getStep("step_2").orElseThrow();
    assertEquals(List.of("userId"), leaf.getParameters());
    assertEquals(List.of("step_1"), leaf.getDependsOn());
    assertTrue(plan.getStep("step_1").orElseThrow().getDependsOn().isEmpty());
  }

  @Test
  void user_lookup_by_transaction_subquery_is_rewritten() {
    PlanStep topTransaction =
        new PlanStep(
            ServiceIdentifier.WALLET,
            "Largest transaction",
            "SELECT \"userId\" FROM \"Transaction\" ORDER BY amount DESC LIMIT 1");
    PlanStep user =
        new PlanStep(
            ServiceIdentifier.PAM,
            "User of the largest transaction",
            "SELECT * FROM \"User\" WHERE id = "
                + "(SELECT \"userId\" FROM \"Transaction\" ORDER BY amount DESC LIMIT 1)");

    DistributedQueryPlan plan =
        builder.build(QueryPlan.of(topTransaction, user), "Show the user");

    QueryStep rewritten = plan.getStep("step_2").orElseThrow();
    assertEquals("SELECT * FROM \"User\" WHERE id = $1", rewritten.getSqlQuery());
    assertEquals(List.of("userId"), rewritten.getParameters());
    assertEquals(List.of("step_1"), rewritten.getDependsOn());
  }

  @Test
  void transaction_subquery_without_ordering_is_replaced_in_place() {
    PlanStep transactions =
        new PlanStep(
            ServiceIdentifier.WALLET, "Transactions", "SELECT \"userId\" FROM \"Transaction\"");
    PlanStep user =
        new PlanStep(
            ServiceIdentifier.PAM,
            "User",
            "SELECT username FROM \"User\" WHERE id = "
                + "(SELECT \"userId\" FROM \"Transaction\" LIMIT 1) AND email IS NOT NULL");

    DistributedQueryPlan plan = builder.build(QueryPlan.of(transactions, user), "Show the user");

    assertEquals(
        "SELECT username FROM \"User\" WHERE id = $1 AND email IS NOT NULL",
        plan.getStep("step_2").orElseThrow().getSqlQuery());
  }

  @Test
  void plan_ids_are_unique() {
    QueryPlan flat = QueryPlan.of(DEPOSITS, BETS);

    assertNotEquals(builder.build(flat, "q").getId(), builder.build(flat, "q").getId());
  }

  private static List<String> ids(DistributedQueryPlan plan) {
    return plan.getSteps().stream().map(QueryStep::getId).collect(Collectors.toList());
  }
}
