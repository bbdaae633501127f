/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.common.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringUtilsTest {

  @Test
  void testEscapeSingleQuotes() {
    assertEquals("O''Brien", StringUtils.escapeSingleQuotes("O'Brien"));
    assertEquals("plain", StringUtils.escapeSingleQuotes("plain"));
  }

  @Test
  void testLevenshtein() {
    assertEquals(0, StringUtils.levenshtein("user", "user"));
    assertEquals(1, StringUtils.levenshtein("users", "user"));
    assertEquals(3, StringUtils.levenshtein("kitten", "sitting"));
    assertEquals(4, StringUtils.levenshtein("", "user"));
  }

  @Test
  void testSimilarity() {
    assertEquals(1.0, StringUtils.similarity("", ""));
    assertEquals(0.8, StringUtils.similarity("users", "user"), 1e-9);
    assertTrue(StringUtils.similarity("transaction", "transactions") > 0.7);
    assertTrue(StringUtils.similarity("bet", "wallet") < 0.7);
  }
}
