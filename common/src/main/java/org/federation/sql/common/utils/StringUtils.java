/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.common.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class StringUtils {

  /**
   * Escape single quotes for embedding the value in a SQL string literal.
   *
   * @param value raw value
   * @return value with every single quote doubled
   */
  public static String escapeSingleQuotes(String value) {
    return value.replace("'", "''");
  }

  /**
   * Similarity of two strings as {@code 1 - levenshtein / maxLength}, in the range [0, 1].
   * Two empty strings are identical.
   */
  public static double similarity(String a, String b) {
    int maxLength = Math.max(a.length(), b.length());
    if (maxLength == 0) {
      return 1.0;
    }
    return 1.0 - (double) levenshtein(a, b) / maxLength;
  }

  /** Classic edit distance with unit costs for insertion, deletion and substitution. */
  public static int levenshtein(String a, String b) {
    int[] previous = new int[b.length() + 1];
    int[] current = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      previous[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      current[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        current[j] =
            Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
      }
      int[] swap = previous;
      previous = current;
      current = swap;
    }
    return previous[b.length()];
  }
}
