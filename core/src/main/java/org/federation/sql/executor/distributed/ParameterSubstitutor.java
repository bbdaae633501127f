/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;
import org.federation.sql.lexer.SqlToken;
import org.federation.sql.lexer.SqlTokenizer;

/**
 * Fills the placeholders of a step's SQL with values taken from the first row of its
 * dependencies' results. Values are rendered as SQL literals, so the text handed to the data
 * source never carries unescaped input.
 */
@Log4j2
public final class ParameterSubstitutor {

  private ParameterSubstitutor() {}

  /**
   * Substitute parameters.
   *
   * @param sql step SQL
   * @param parameters parameter names in declaration order
   * @param dependencyResults results of the step's dependencies in dependency order
   * @return SQL with every resolvable placeholder replaced by a literal
   */
  public static String substitute(
      String sql, List<String> parameters, Map<String, List<Row>> dependencyResults) {
    if (parameters == null || parameters.isEmpty()) {
      return sql;
    }
    Map<String, RowValue> values = new LinkedHashMap<>();
    for (String parameter : parameters) {
      Optional<RowValue> value = resolve(parameter, dependencyResults);
      if (value.isPresent()) {
        values.put(parameter, value.get());
      } else {
        log.warn("Unable to resolve parameter {} from dependency results", parameter);
      }
    }

    List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
    List<SqlToken> substituted = new ArrayList<>(tokens.size());
    int questionMarks = 0;
    for (SqlToken token : tokens) {
      String parameter = null;
      if (token.isNamedParameter()) {
        parameter = declared(parameters, token.parameterName());
      } else if (token.isPositionalParameter() && token.position() > 0) {
        parameter = indexed(parameters, token.position() - 1);
      } else if (token.isPositionalParameter()) {
        parameter = indexed(parameters, questionMarks++);
      }
      if (parameter != null && values.containsKey(parameter)) {
        substituted.add(token.withText(values.get(parameter).toSqlLiteral()));
      } else {
        substituted.add(token);
      }
    }
    return SqlTokenizer.render(substituted);
  }

  /** Value of the first column matching the parameter in the first row of any dependency. */
  static Optional<RowValue> resolve(String parameter, Map<String, List<Row>> dependencyResults) {
    for (List<Row> rows : dependencyResults.values()) {
      if (rows == null || rows.isEmpty()) {
        continue;
      }
      Optional<Map.Entry<String, RowValue>> column = rows.get(0).findIgnoreCase(parameter);
      if (column.isPresent()) {
        return Optional.of(column.get().getValue());
      }
    }
    return Optional.empty();
  }

  private static String declared(List<String> parameters, String name) {
    return parameters.stream().filter(name::equalsIgnoreCase).findFirst().orElse(null);
  }

  private static String indexed(List<String> parameters, int index) {
    return index < parameters.size() ? parameters.get(index) : null;
  }
}
