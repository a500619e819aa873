/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.planner;

import org.opensearch.tsquery.coordinator.exec.ExecPlan;
import org.opensearch.tsquery.coordinator.plan.logical.LogicalPlan;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/** Turns a logical plan into an execution plan. */
public interface QueryPlanner {

  /**
   * Plans the execution of a logical plan.
   *
   * @param plan a well-formed logical plan
   * @param context context of the query the plan answers
   * @return root of the execution plan
   */
  ExecPlan materialize(LogicalPlan plan, QueryContext context);
}
