/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

import java.util.ArrayList;
import java.util.List;
import lombok.experimental.UtilityClass;
import org.federation.sql.lexer.SqlToken;
import org.federation.sql.lexer.SqlTokenizer;

/**
 * Finds the placeholders of a SQL text that must be resolved from earlier steps. Positional
 * placeholders ({@code ?}, {@code $N}) stand for the user id unless the SQL names its parameters.
 */
@UtilityClass
public class ParameterDetector {

  public static final String USER_ID = "userId";

  /** Declared parameter names in order of first appearance, without duplicates. */
  public static List<String> detect(String sql) {
    List<String> names = new ArrayList<>();
    boolean questionMark = false;
    boolean dollarPosition = false;
    for (SqlToken token : SqlTokenizer.tokenize(sql)) {
      if (token.isNamedParameter()) {
        addOnce(names, token.parameterName());
      } else if (token.isPositionalParameter()) {
        if (token.position() > 0) {
          dollarPosition = true;
        } else {
          questionMark = true;
        }
      }
    }
    if (questionMark) {
      names.add(0, USER_ID);
      dedupe(names);
    } else if (dollarPosition && names.isEmpty()) {
      names.add(USER_ID);
    }
    return names;
  }

  private static void addOnce(List<String> names, String name) {
    if (!names.contains(name)) {
      names.add(name);
    }
  }

  private static void dedupe(List<String> names) {
    for (int i = names.size() - 1; i > 0; i--) {
      if (names.indexOf(names.get(i)) != i) {
        names.remove(i);
      }
    }
  }
}
