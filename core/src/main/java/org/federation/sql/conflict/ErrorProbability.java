/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.conflict;

/** Risk that a plan queries the wrong copy of a table name shared by several services. */
public enum ErrorProbability {
  /** No referenced table is shared */
  LOW,

  /** Shared tables are referenced, but at most one owner of each is part of the plan */
  MEDIUM,

  /** Two or more owners of the same shared table are part of the plan */
  HIGH
}
