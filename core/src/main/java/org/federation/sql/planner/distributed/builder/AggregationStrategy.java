/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed.builder;

/** How the results of several leaf steps are combined into one answer. */
public enum AggregationStrategy {
  /** Count rows across every leaf */
  COUNT,

  /** Find the rows holding the maximum of a candidate field */
  MAX,

  /** Join, sort by candidate fields and keep the top rows */
  SORT_LIMIT,

  /** Fold the leaves with pairwise joins on the shared key */
  JOIN
}
