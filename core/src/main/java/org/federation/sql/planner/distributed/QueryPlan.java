/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.federation.sql.catalog.model.ServiceIdentifier;

/** Ordered per-service steps without dependency information. */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class QueryPlan {

  private List<PlanStep> steps = new ArrayList<>();

  private Set<ServiceIdentifier> requiredServices = new LinkedHashSet<>();

  /** Flat plan whose required services are the services of its steps, in order. */
  public static QueryPlan of(PlanStep... steps) {
    QueryPlan plan = new QueryPlan();
    for (PlanStep step : steps) {
      plan.steps.add(step);
      plan.requiredServices.add(step.service());
    }
    return plan;
  }
}
