/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/** Distinct values of the given labels among series matching the filters. */
@Value
public class LabelValues implements FilteredPlan {

  ImmutableList<String> labelNames;
  ImmutableList<ColumnFilter> filters;
  long startMs;
  long endMs;

  public LabelValues(
      List<String> labelNames, List<ColumnFilter> filters, long startMs, long endMs) {
    this.labelNames = ImmutableList.copyOf(labelNames);
    this.filters = ImmutableList.copyOf(filters);
    this.startMs = startMs;
    this.endMs = endMs;
  }
}
