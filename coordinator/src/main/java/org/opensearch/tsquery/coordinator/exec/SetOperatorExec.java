/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.exec;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import org.opensearch.tsquery.coordinator.plan.logical.BinaryOperator;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/**
 * Applies {@code and}, {@code or} or {@code unless} to the series of its two sides. Set operators
 * keep or drop whole series, so they carry no cardinality and no include labels: a join's {@code
 * group_left} or {@code group_right} is not carried over. {@code on} is null when the join has no
 * {@code on} clause.
 */
@Getter
public class SetOperatorExec extends NonLeafExecPlan {

  private final ImmutableList<ExecPlan> lhs;
  private final ImmutableList<ExecPlan> rhs;
  private final BinaryOperator operator;
  private final ImmutableList<String> on;
  private final ImmutableList<String> ignoring;
  private final String metricColumn;

  public SetOperatorExec(
      QueryContext queryContext,
      PlanDispatcher dispatcher,
      List<ExecPlan> lhs,
      List<ExecPlan> rhs,
      BinaryOperator operator,
      List<String> on,
      List<String> ignoring,
      String metricColumn) {
    super(queryContext, dispatcher, concat(lhs, rhs));
    Preconditions.checkArgument(operator.isSetOperator(), "%s is not a set operator", operator);
    this.lhs = ImmutableList.copyOf(lhs);
    this.rhs = ImmutableList.copyOf(rhs);
    this.operator = operator;
    this.on = on == null ? null : ImmutableList.copyOf(on);
    this.ignoring = ImmutableList.copyOf(ignoring);
    this.metricColumn = metricColumn;
  }

  @Override
  protected String args() {
    return String.format("binaryOp=%s, on=%s, ignoring=%s", operator, on, ignoring);
  }
}
