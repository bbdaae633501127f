/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ParameterDetectorTest {

  @Test
  void named_placeholders_in_order_without_duplicates() {
    assertEquals(
        List.of("userId", "since", "limit"),
        ParameterDetector.detect(
            "SELECT * FROM bets WHERE \"userId\" = :userId AND a > ${since} "
                + "AND b = :userId LIMIT $limit"));
  }

  @Test
  void question_mark_stands_for_user_id() {
    assertEquals(List.of("userId"), ParameterDetector.detect("SELECT * FROM bets WHERE id = ?"));
  }

  @Test
  void question_mark_with_named_user_id_is_recorded_once() {
    assertEquals(
        List.of("userId", "from"),
        ParameterDetector.detect("SELECT 1 WHERE a = ? AND b = :from AND c = :userId"));
  }

  @Test
  void dollar_position_implies_user_id_only_without_named_parameters() {
    assertEquals(
        List.of("userId"), ParameterDetector.detect("SELECT * FROM \"User\" WHERE id = $1"));
    assertEquals(List.of("day"), ParameterDetector.detect("SELECT 1 WHERE a = $1 AND d = @day"));
  }

  @Test
  void casts_and_literals_are_not_parameters() {
    assertTrue(
        ParameterDetector.detect(
                "SELECT \"createdAt\"::date, ':fake', '${no}' FROM bets WHERE x::text = 'a'")
            .isEmpty());
  }
}
