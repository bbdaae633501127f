/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

import org.federation.sql.catalog.model.ServiceIdentifier;

/** A table a step mentions that is owned by another service. */
public record CrossServiceReference(String table, ServiceIdentifier service) {}
