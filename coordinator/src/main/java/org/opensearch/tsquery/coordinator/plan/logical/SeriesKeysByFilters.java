/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/** Keys of series matching the filters, optionally with their first and last sample times. */
@Value
public class SeriesKeysByFilters implements FilteredPlan {

  ImmutableList<ColumnFilter> filters;
  boolean fetchFirstLastSampleTimes;
  long startMs;
  long endMs;

  public SeriesKeysByFilters(
      List<ColumnFilter> filters, boolean fetchFirstLastSampleTimes, long startMs, long endMs) {
    this.filters = ImmutableList.copyOf(filters);
    this.fetchFirstLastSampleTimes = fetchFirstLastSampleTimes;
    this.startMs = startMs;
    this.endMs = endMs;
  }
}
