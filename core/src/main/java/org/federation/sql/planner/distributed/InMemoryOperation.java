/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

/** Relational operation a synthetic step performs over the rows of its dependencies. */
public enum InMemoryOperation {
  /** Inner hash join on a shared key column. Arguments: key. */
  JOIN,

  /** Row predicate. Arguments: field, operator, value. */
  FILTER,

  /** Reserved, not produced by the plan builder. */
  GROUP,

  /** Arguments: field, direction. */
  SORT,

  /** Arguments: function, field. */
  AGGREGATE,

  /** Arguments: limit and an optional offset. */
  LIMIT,

  /** Reserved, not produced by the plan builder. */
  MAP,

  /** Reserved, not produced by the plan builder. */
  REDUCE
}
