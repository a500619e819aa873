/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import lombok.Value;

/** Aggregates the series of a child plan, grouped by or without a set of labels. */
@Value
public class Aggregation implements LogicalPlan {

  AggregationOperator operator;
  LogicalPlan vectors;
  ImmutableList<String> by;
  ImmutableList<String> without;

  public Aggregation(
      AggregationOperator operator, LogicalPlan vectors, List<String> by, List<String> without) {
    Preconditions.checkArgument(
        by.isEmpty() || without.isEmpty(), "Only one of by and without may be given");
    this.operator = operator;
    this.vectors = vectors;
    this.by = ImmutableList.copyOf(by);
    this.without = ImmutableList.copyOf(without);
  }

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of(vectors);
  }

  public enum AggregationOperator {
    SUM,
    AVG,
    MIN,
    MAX,
    COUNT,
    STDDEV,
    TOPK,
    BOTTOMK;

    public String getName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }
}
