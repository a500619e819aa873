/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

/** Sends an execution plan node to the place it runs. */
public interface PlanDispatcher {

  DispatchLocation getLocation();

  /** How long the caller waits for the dispatched node's result. */
  long getTimeoutMs();
}
