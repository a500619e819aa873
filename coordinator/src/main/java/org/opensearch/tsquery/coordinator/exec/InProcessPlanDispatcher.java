/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import lombok.Value;
import org.opensearch.tsquery.query.QueryConfig;

/** Runs plan nodes in the planning process itself. */
@Value
public class InProcessPlanDispatcher implements PlanDispatcher {

  QueryConfig queryConfig;

  @Override
  public DispatchLocation getLocation() {
    return DispatchLocation.LOCAL;
  }

  @Override
  public long getTimeoutMs() {
    return queryConfig.getAskTimeoutMs();
  }
}
