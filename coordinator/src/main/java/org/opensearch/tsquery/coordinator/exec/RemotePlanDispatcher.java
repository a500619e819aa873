/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import lombok.NonNull;
import lombok.Value;

/** Sends plan nodes to the query endpoint of another cluster. */
@Value
public class RemotePlanDispatcher implements PlanDispatcher {

  @NonNull String endpoint;
  long timeoutMs;

  @Override
  public DispatchLocation getLocation() {
    return DispatchLocation.REMOTE;
  }
}
