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
import org.opensearch.tsquery.coordinator.plan.logical.Cardinality;
import org.opensearch.tsquery.coordinator.query.QueryContext;

/**
 * Joins the series produced by its left children with those of its right children. {@code on} is
 * null when the join has no {@code on} clause.
 */
@Getter
public class BinaryJoinExec extends NonLeafExecPlan {

  private final ImmutableList<ExecPlan> lhs;
  private final ImmutableList<ExecPlan> rhs;
  private final BinaryOperator operator;
  private final Cardinality cardinality;
  private final ImmutableList<String> on;
  private final ImmutableList<String> ignoring;
  private final ImmutableList<String> include;
  private final String metricColumn;

  public BinaryJoinExec(
      QueryContext queryContext,
      PlanDispatcher dispatcher,
      List<ExecPlan> lhs,
      List<ExecPlan> rhs,
      BinaryOperator operator,
      Cardinality cardinality,
      List<String> on,
      List<String> ignoring,
      List<String> include,
      String metricColumn) {
    super(queryContext, dispatcher, concat(lhs, rhs));
    Preconditions.checkArgument(
        !operator.isSetOperator(), "Set operator %s needs a SetOperatorExec", operator);
    this.lhs = ImmutableList.copyOf(lhs);
    this.rhs = ImmutableList.copyOf(rhs);
    this.operator = operator;
    this.cardinality = cardinality;
    this.on = on == null ? null : ImmutableList.copyOf(on);
    this.ignoring = ImmutableList.copyOf(ignoring);
    this.include = ImmutableList.copyOf(include);
    this.metricColumn = metricColumn;
  }

  @Override
  protected String args() {
    return String.format(
        "binaryOp=%s, on=%s, ignoring=%s, include=%s", operator, on, ignoring, include);
  }
}
