/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import java.util.function.BiPredicate;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.federation.sql.data.model.RowValue;

/**
 * Predicate operators of the FILTER step. Ordering comparisons coerce both sides to numbers, so a
 * value without numeric meaning never satisfies them.
 */
@RequiredArgsConstructor
public enum ComparisonOperator {
  EQ("=", ComparisonOperator::looseEquals),
  DOUBLE_EQ("==", ComparisonOperator::looseEquals),
  NEQ("!=", (field, value) -> !looseEquals(field, value)),
  GT(">", (field, value) -> field.toDouble() > value.toDouble()),
  GTE(">=", (field, value) -> field.toDouble() >= value.toDouble()),
  LT("<", (field, value) -> field.toDouble() < value.toDouble()),
  LTE("<=", (field, value) -> field.toDouble() <= value.toDouble()),
  IN("in", ComparisonOperator::in),
  LIKE("like", (field, value) -> field.asString().contains(value.asString()));

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Getter private final String symbol;

  private final BiPredicate<RowValue, RowValue> predicate;

  public static Optional<ComparisonOperator> fromSymbol(String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equalsIgnoreCase(symbol)).findFirst();
  }

  public boolean test(RowValue field, RowValue value) {
    return predicate.test(field, value);
  }

  /**
   * Null equals only null. Otherwise values compare numerically when both have a numeric meaning
   * and by string form when not.
   */
  static boolean looseEquals(RowValue field, RowValue value) {
    if (field.isNull() || value.isNull()) {
      return field.isNull() && value.isNull();
    }
    double left = field.toDouble();
    double right = value.toDouble();
    if (!Double.isNaN(left) && !Double.isNaN(right)) {
      return left == right;
    }
    return field.asString().equals(value.asString());
  }

  /** Membership in a JSON array value; any other value matches nothing. */
  private static boolean in(RowValue field, RowValue value) {
    JsonNode candidates = value.isJson() ? value.jsonValue() : parseArray(value.asString());
    if (candidates == null || !candidates.isArray()) {
      return false;
    }
    for (JsonNode candidate : candidates) {
      if (looseEquals(field, RowValue.of(candidate))) {
        return true;
      }
    }
    return false;
  }

  private static JsonNode parseArray(String text) {
    if (!text.trim().startsWith("[")) {
      return null;
    }
    try {
      return MAPPER.readTree(text);
    } catch (IOException e) {
      return null;
    }
  }
}
