/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

import org.federation.sql.catalog.model.ServiceIdentifier;

/** A column a step mentions that lives in a table of another service. */
public record CrossServiceColumn(
    String column, ServiceIdentifier sourceService, String sourceTable) {}
