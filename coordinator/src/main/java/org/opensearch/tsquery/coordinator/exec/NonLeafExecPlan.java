/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/** A plan node that combines the results of the child nodes it owns. */
public abstract class NonLeafExecPlan extends ExecPlan {

  private final ImmutableList<ExecPlan> children;

  protected NonLeafExecPlan(
      QueryContext queryContext, PlanDispatcher dispatcher, List<ExecPlan> children) {
    super(queryContext, dispatcher);
    Preconditions.checkArgument(
        !children.isEmpty(), "%s needs children", getClass().getSimpleName());
    this.children = ImmutableList.copyOf(children);
  }

  @Override
  public List<ExecPlan> getChildren() {
    return children;
  }

  protected static List<ExecPlan> concat(List<ExecPlan> lhs, List<ExecPlan> rhs) {
    return ImmutableList.<ExecPlan>builder().addAll(lhs).addAll(rhs).build();
  }
}
