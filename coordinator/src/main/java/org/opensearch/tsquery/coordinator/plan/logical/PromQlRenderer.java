/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;

/**
 * Renders series queries as PromQL. Metadata queries (label values, label names, series keys and
 * cardinalities) are not expressions and cannot be rendered.
 */
@RequiredArgsConstructor
public class PromQlRenderer implements LogicalPlanRenderer {

  private static final Pattern METRIC_NAME = Pattern.compile("[a-zA-Z_:][a-zA-Z0-9_:]*");

  private final String metricColumn;

  @Override
  public String convertToQuery(LogicalPlan plan) {
    if (plan instanceof RawSeries raw) {
      return rawSeries(raw);
    } else if (plan instanceof PeriodicSeries periodic) {
      String series = rawSeries(periodic.getRawSeries());
      return periodic.getRangeFunction() == null
          ? series
          : periodic.getRangeFunction() + "(" + series + ")";
    } else if (plan instanceof Aggregation aggregation) {
      return aggregation(aggregation);
    } else if (plan instanceof BinaryJoin join) {
      return binaryJoin(join);
    }
    throw new UnsupportedOperationException(
        "Cannot render " + plan.getClass().getSimpleName() + " as PromQL");
  }

  private String rawSeries(RawSeries raw) {
    String metric = null;
    List<String> matchers = new ArrayList<>();
    for (ColumnFilter filter : raw.getFilters()) {
      if (metric == null && LogicalPlanUtils.isMetricFilter(filter, metricColumn)) {
        metric = filter.getValue();
      } else {
        matchers.add(matcher(filter));
      }
    }
    if (metric != null && !METRIC_NAME.matcher(metric).matches()) {
      // not a bare identifier, so it can only be selected through its label
      matchers.add(0, matcher(LogicalPlanUtils.METRIC_LABEL, "=", metric));
      metric = null;
    }
    StringBuilder query = new StringBuilder(metric == null ? "" : metric);
    if (metric == null || !matchers.isEmpty()) {
      query.append('{').append(String.join(",", matchers)).append('}');
    }
    if (raw.getRangeMs() > 0) {
      query.append('[').append(duration(raw.getRangeMs())).append(']');
    }
    return query.toString();
  }

  private String aggregation(Aggregation aggregation) {
    StringBuilder query = new StringBuilder(aggregation.getOperator().getName());
    if (!aggregation.getBy().isEmpty()) {
      query.append(" by (").append(labels(aggregation.getBy())).append(')');
    } else if (!aggregation.getWithout().isEmpty()) {
      query.append(" without (").append(labels(aggregation.getWithout())).append(')');
    }
    query.append('(').append(convertToQuery(aggregation.getVectors())).append(')');
    return query.toString();
  }

  private String binaryJoin(BinaryJoin join) {
    StringBuilder query = new StringBuilder(operand(join.getLhs()));
    query.append(' ').append(join.getOperator().getSymbol());
    if (join.getOn() != null) {
      query.append(" on(").append(labels(join.getOn())).append(')');
    } else if (!join.getIgnoring().isEmpty()) {
      query.append(" ignoring(").append(labels(join.getIgnoring())).append(')');
    }
    if (join.getCardinality() == Cardinality.MANY_TO_ONE) {
      query.append(" group_left(").append(labels(join.getInclude())).append(')');
    } else if (join.getCardinality() == Cardinality.ONE_TO_MANY) {
      query.append(" group_right(").append(labels(join.getInclude())).append(')');
    }
    return query.append(' ').append(operand(join.getRhs())).toString();
  }

  private String operand(LogicalPlan plan) {
    String query = convertToQuery(plan);
    return plan instanceof BinaryJoin ? "(" + query + ")" : query;
  }

  private static String matcher(ColumnFilter filter) {
    return matcher(filter.getColumn(), filter.getOperator().getSymbol(), filter.getValue());
  }

  private static String matcher(String label, String symbol, String value) {
    String escaped = value.replace("\\", "\\\\").replace("\"", "\\\"");
    return label + symbol + '"' + escaped + '"';
  }

  private static String labels(List<String> labels) {
    return String.join(",", labels);
  }

  static String duration(long millis) {
    if (millis % 3_600_000L == 0) {
      return millis / 3_600_000L + "h";
    } else if (millis % 60_000L == 0) {
      return millis / 60_000L + "m";
    } else if (millis % 1_000L == 0) {
      return millis / 1_000L + "s";
    }
    return millis + "ms";
  }
}
