/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * Samples a raw series at every step from start to end, optionally applying a range function such
 * as {@code rate} over each lookback window.
 */
@Value
public class PeriodicSeries implements LogicalPlan {

  @NonNull RawSeries rawSeries;
  long startMs;
  long stepMs;
  long endMs;

  /** Range function name, or null for plain instant sampling. */
  String rangeFunction;

  public static PeriodicSeries instant(RawSeries rawSeries, long startMs, long stepMs, long endMs) {
    return new PeriodicSeries(rawSeries, startMs, stepMs, endMs, null);
  }

  @Override
  public List<LogicalPlan> getChildren() {
    return List.of(rawSeries);
  }
}
