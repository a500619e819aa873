/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/** Names of all labels used by series matching the filters. */
@Value
public class LabelNames implements FilteredPlan {

  ImmutableList<ColumnFilter> filters;
  long startMs;
  long endMs;

  public LabelNames(List<ColumnFilter> filters, long startMs, long endMs) {
    this.filters = ImmutableList.copyOf(filters);
    this.startMs = startMs;
    this.endMs = endMs;
  }
}
