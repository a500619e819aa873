/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.experimental.UtilityClass;

@UtilityClass
public class LogicalPlanUtils {

  /** Label under which queries may refer to the metric name, whatever the dataset calls it. */
  public static final String METRIC_LABEL = "__name__";

  /**
   * Finds the first metric name a plan selects on, walking the tree in pre-order with left
   * children before right ones. A metric is selected by an equality filter on the dataset's metric
   * column or on {@link #METRIC_LABEL}.
   */
  public static Optional<String> getMetricName(LogicalPlan plan, String metricColumn) {
    if (plan instanceof FilteredPlan filtered) {
      for (ColumnFilter filter : filtered.getFilters()) {
        if (isMetricFilter(filter, metricColumn)) {
          return Optional.of(filter.getValue());
        }
      }
    }
    for (LogicalPlan child : plan.getChildren()) {
      Optional<String> metric = getMetricName(child, metricColumn);
      if (metric.isPresent()) {
        return metric;
      }
    }
    return Optional.empty();
  }

  static boolean isMetricFilter(ColumnFilter filter, String metricColumn) {
    return filter.getOperator() == ColumnFilter.FilterOperator.EQUALS
        && (filter.getColumn().equals(metricColumn) || filter.getColumn().equals(METRIC_LABEL));
  }

  /**
   * Replaces every {@link #METRIC_LABEL} in a label list with the dataset's metric column. A null
   * list stays null.
   */
  public static List<String> renameLabels(List<String> labels, String metricColumn) {
    if (labels == null) {
      return null;
    }
    return labels.stream()
        .map(label -> label.equals(METRIC_LABEL) ? metricColumn : label)
        .collect(ImmutableList.toImmutableList());
  }
}
