/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum AggregateFunction {
  MAX,
  MIN,
  SUM,
  AVG,
  COUNT;

  public static Optional<AggregateFunction> of(String name) {
    return Arrays.stream(values()).filter(fn -> fn.name().equalsIgnoreCase(name)).findFirst();
  }

  /** Column name of the result row. */
  public String columnName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
