/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import java.util.List;
import org.opensearch.tsquery.coordinator.query.PromQlQueryParams;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/** Sends the query text of its context to another cluster and returns that cluster's answer. */
public class PromQlRemoteExec extends ExecPlan {

  public PromQlRemoteExec(QueryContext queryContext, RemotePlanDispatcher dispatcher) {
    super(queryContext, dispatcher);
  }

  public String getEndpoint() {
    return ((RemotePlanDispatcher) getDispatcher()).getEndpoint();
  }

  @Override
  public List<ExecPlan> getChildren() {
    return List.of();
  }

  @Override
  protected String args() {
    PromQlQueryParams params = getQueryContext().getOrigQueryParams();
    return String.format(
        "promQl=%s, start=%d, step=%d, end=%d, endpoint=%s",
        params.getPromQl(),
        params.getStartSecs(),
        params.getStepSecs(),
        params.getEndSecs(),
        getEndpoint());
  }
}
