/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.coordinator.plan.logical.Aggregation.AggregationOperator;
import org.opensearch.tsquery.coordinator.plan.logical.ColumnFilter.FilterOperator;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LogicalPlanUtilsTest {

  private static final String METRIC = "_metric_";

  @Test
  void should_find_the_metric_of_a_raw_series() {
    RawSeries series =
        RawSeries.of(ColumnFilter.equalTo("job", "app"), ColumnFilter.equalTo(METRIC, "cpu"));

    assertEquals(Optional.of("cpu"), LogicalPlanUtils.getMetricName(series, METRIC));
  }

  @Test
  void should_accept_the_metric_label_in_place_of_the_metric_column() {
    RawSeries series = RawSeries.of(ColumnFilter.equalTo("__name__", "cpu"));

    assertEquals(Optional.of("cpu"), LogicalPlanUtils.getMetricName(series, METRIC));
  }

  @Test
  void should_ignore_metric_filters_that_are_not_equality() {
    RawSeries series = RawSeries.of(new ColumnFilter(METRIC, FilterOperator.REGEX_MATCH, "cpu.*"));

    assertEquals(Optional.empty(), LogicalPlanUtils.getMetricName(series, METRIC));
  }

  @Test
  void should_take_the_leftmost_metric_of_a_tree() {
    LogicalPlan plan =
        new Aggregation(
            AggregationOperator.SUM,
            BinaryJoin.builder()
                .lhs(RawSeries.of(ColumnFilter.equalTo("job", "app")))
                .operator(BinaryOperator.ADD)
                .rhs(
                    BinaryJoin.builder()
                        .lhs(RawSeries.of(ColumnFilter.equalTo(METRIC, "first")))
                        .operator(BinaryOperator.ADD)
                        .rhs(RawSeries.of(ColumnFilter.equalTo(METRIC, "second")))
                        .build())
                .build(),
            List.of("host"),
            List.of());

    assertEquals(Optional.of("first"), LogicalPlanUtils.getMetricName(plan, METRIC));
  }

  @Test
  void should_find_metrics_of_metadata_queries() {
    LabelValues plan =
        new LabelValues(List.of("host"), List.of(ColumnFilter.equalTo(METRIC, "mem")), 0L, 1L);

    assertEquals(Optional.of("mem"), LogicalPlanUtils.getMetricName(plan, METRIC));
    assertEquals(
        Optional.empty(),
        LogicalPlanUtils.getMetricName(new TsCardinalities(List.of("ws"), 2), METRIC));
  }

  @Test
  void should_rename_the_metric_label_only() {
    assertEquals(
        List.of("host", METRIC, "job"),
        LogicalPlanUtils.renameLabels(List.of("host", "__name__", "job"), METRIC));
    assertEquals(List.of(), LogicalPlanUtils.renameLabels(List.of(), METRIC));
    assertNull(LogicalPlanUtils.renameLabels(null, METRIC));
  }
}
