/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Matches the series of two plans label by label and applies {@link #operator} to each match.
 * {@code on} and {@code ignoring} restrict the labels used for matching; {@code include} lists
 * labels copied from the "one" side of a one-to-many or many-to-one match. A null {@code on}
 * means the join has no {@code on} clause, while an empty one is {@code on()} and matches every
 * series regardless of labels.
 */
@Value
@Builder
public class BinaryJoin implements LogicalPlan {

  @NonNull LogicalPlan lhs;
  @NonNull BinaryOperator operator;
  @Builder.Default Cardinality cardinality = Cardinality.ONE_TO_ONE;
  @NonNull LogicalPlan rhs;
  List<String> on;
  @Builder.Default List<String> ignoring = ImmutableList.of();
  @Builder.Default List<String> include = ImmutableList.of();

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of(lhs, rhs);
  }
}
