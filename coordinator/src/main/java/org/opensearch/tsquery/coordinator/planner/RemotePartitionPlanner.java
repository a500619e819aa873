/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.planner;

import lombok.RequiredArgsConstructor;
import org.opensearch.tsquery.coordinator.exec.ExecPlan;
import org.opensearch.tsquery.coordinator.exec.PromQlRemoteExec;
import org.opensearch.tsquery.coordinator.exec.RemotePlanDispatcher;
import org.opensearch.tsquery.coordinator.plan.logical.LabelNames;
import org.opensearch.tsquery.coordinator.plan.logical.LabelValues;
import org.opensearch.tsquery.coordinator.plan.logical.LogicalPlan;
import org.opensearch.tsquery.coordinator.plan.logical.SeriesKeysByFilters;
import org.opensearch.tsquery.coordinator.plan.logical.TsCardinalities;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/**
 * Plans every query of one partition as a single remote call. The partition's own cluster parses
 * and plans the query text carried by the context.
 *
 * <p>Metadata plans (label values, label names, series keys, cardinalities) have no query text to
 * carry, so they are rejected rather than sent as the text of the enclosing series query.
 */
@RequiredArgsConstructor
public class RemotePartitionPlanner implements QueryPlanner {

  private final RemotePlanDispatcher dispatcher;

  @Override
  public ExecPlan materialize(LogicalPlan plan, QueryContext context) {
    if (plan instanceof LabelValues
        || plan instanceof LabelNames
        || plan instanceof SeriesKeysByFilters
        || plan instanceof TsCardinalities) {
      throw new UnsupportedOperationException(
          "Remote partition " + dispatcher.getEndpoint() + " cannot plan metadata query "
              + plan.getClass().getSimpleName());
    }
    return new PromQlRemoteExec(context, dispatcher);
  }

  @Override
  public String toString() {
    return "RemotePartitionPlanner(" + dispatcher.getEndpoint() + ")";
  }
}
