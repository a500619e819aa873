/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import java.util.List;

/** Node of an immutable, parsed query tree. */
public interface LogicalPlan {

  /** Returns the direct children of this node, left to right. */
  default List<LogicalPlan> getChildren() {
    return List.of();
  }
}
