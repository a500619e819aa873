/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

/** Where an execution plan node runs. */
public enum DispatchLocation {
  /** On the node that planned the query. */
  LOCAL,

  /** On another cluster, reached over the network. */
  REMOTE
}
