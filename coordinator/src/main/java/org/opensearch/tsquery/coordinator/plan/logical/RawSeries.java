/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Raw samples of every series matching the filters. A positive {@code rangeMs} makes this a range
 * selector that looks back that far from each evaluation instant.
 */
@Value
public class RawSeries implements FilteredPlan {

  ImmutableList<ColumnFilter> filters;
  ImmutableList<String> columns;
  long rangeMs;

  public RawSeries(List<ColumnFilter> filters, List<String> columns, long rangeMs) {
    this.filters = ImmutableList.copyOf(filters);
    this.columns = ImmutableList.copyOf(columns);
    this.rangeMs = rangeMs;
  }

  public static RawSeries of(ColumnFilter... filters) {
    return new RawSeries(List.of(filters), List.of(), 0L);
  }
}
