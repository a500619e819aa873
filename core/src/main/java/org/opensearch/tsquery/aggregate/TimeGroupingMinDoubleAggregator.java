/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

/** Minimum value per time bucket. Empty buckets hold positive infinity. */
public class TimeGroupingMinDoubleAggregator extends TimeGroupingAggregator<DoubleBufferAggregate> {

  public TimeGroupingMinDoubleAggregator(
      int timeColIndex, int valueColIndex, long startTs, long endTs, int numBuckets) {
    super(timeColIndex, valueColIndex, startTs, endTs, numBuckets);
  }

  @Override
  public DoubleBufferAggregate emptyAggregate() {
    return new DoubleBufferAggregate(getNumBuckets(), Double.POSITIVE_INFINITY);
  }

  @Override
  protected void update(DoubleBufferAggregate aggregate, int bucket, double value) {
    if (value < aggregate.get(bucket)) {
      aggregate.set(bucket, value);
    }
  }

  @Override
  public DoubleBufferAggregate combine(DoubleBufferAggregate first, DoubleBufferAggregate second) {
    DoubleBufferAggregate merged = emptyAggregate();
    for (int i = 0; i < merged.size(); i++) {
      merged.set(i, Math.min(first.get(i), second.get(i)));
    }
    return merged;
  }
}
