/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class QueryIntentClassifierTest {

  @Test
  void count_wins_over_other_keywords() {
    assertEquals(
        AggregationStrategy.COUNT,
        QueryIntentClassifier.classify("Count the users with the highest balance"));
  }

  @Test
  void strategies_in_both_languages() {
    assertEquals(AggregationStrategy.MAX, QueryIntentClassifier.classify("Largest win"));
    assertEquals(AggregationStrategy.MAX, QueryIntentClassifier.classify("Максимальный депозит"));
    assertEquals(AggregationStrategy.SORT_LIMIT, QueryIntentClassifier.classify("Best players"));
    assertEquals(AggregationStrategy.SORT_LIMIT, QueryIntentClassifier.classify("Топ игроков"));
    assertEquals(AggregationStrategy.JOIN, QueryIntentClassifier.classify("Show deposits"));
    assertEquals(AggregationStrategy.JOIN, QueryIntentClassifier.classify(null));
  }

  @Test
  void maximum_fields_follow_the_question() {
    assertEquals(List.of("amount"), QueryIntentClassifier.maxFields("biggest deposit"));
    assertEquals(
        List.of("createdAt", "created_at", "date"),
        QueryIntentClassifier.maxFields("latest date"));
    assertEquals(List.of("amount", "count", "id"), QueryIntentClassifier.maxFields("biggest"));
  }

  @Test
  void sort_fields_default_when_nothing_matches() {
    assertEquals(
        List.of("id", "amount", "createdAt", "created_at"),
        QueryIntentClassifier.sortFields("top ten"));
    assertEquals(
        List.of("name", "username", "user_name"), QueryIntentClassifier.sortFields("sort by name"));
  }

  @Test
  void direction_is_descending_unless_smallest_requested() {
    assertTrue(QueryIntentClassifier.isDescending("top deposits"));
    assertFalse(QueryIntentClassifier.isDescending("smallest deposits"));
    assertFalse(QueryIntentClassifier.isDescending("наименьшие депозиты"));
  }
}
