/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import java.util.List;
import java.util.UUID;
import lombok.Getter;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/**
 * Node of a physical query plan. Every node knows the context of the query it answers and the
 * dispatcher that decides where it runs.
 */
@Getter
public abstract class ExecPlan {

  private final String planId = UUID.randomUUID().toString();
  private final QueryContext queryContext;
  private final PlanDispatcher dispatcher;

  protected ExecPlan(QueryContext queryContext, PlanDispatcher dispatcher) {
    this.queryContext = queryContext;
    this.dispatcher = dispatcher;
  }

  public abstract List<ExecPlan> getChildren();

  /** Describes the arguments of this node for {@link #printTree()}. */
  protected abstract String args();

  public DispatchLocation getDispatchLocation() {
    return dispatcher.getLocation();
  }

  /**
   * Renders this node and its descendants, one per line. Each level of nesting adds a leading
   * dash.
   */
  public String printTree() {
    StringBuilder tree = new StringBuilder();
    printTree(tree, 0);
    return tree.toString();
  }

  private void printTree(StringBuilder tree, int level) {
    if (level > 0) {
      tree.append('\n');
    }
    tree.append("-".repeat(level))
        .append("E~")
        .append(getClass().getSimpleName())
        .append('(')
        .append(args())
        .append(") on ")
        .append(getDispatchLocation());
    for (ExecPlan child : getChildren()) {
      child.printTree(tree, level + 1);
    }
  }
}
