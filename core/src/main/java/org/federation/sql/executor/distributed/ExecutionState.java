/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

/** Lifecycle of a distributed plan execution. */
public enum ExecutionState {
  INITIALIZING,
  SCHEDULED,
  EXECUTING,
  COMPLETED,
  FAILED
}
