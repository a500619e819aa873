/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

/** Mean value per time bucket. Empty buckets report NaN. */
public class TimeGroupingAvgDoubleAggregator
    extends TimeGroupingAggregator<AverageBufferAggregate> {

  public TimeGroupingAvgDoubleAggregator(
      int timeColIndex, int valueColIndex, long startTs, long endTs, int numBuckets) {
    super(timeColIndex, valueColIndex, startTs, endTs, numBuckets);
  }

  @Override
  public AverageBufferAggregate emptyAggregate() {
    return new AverageBufferAggregate(getNumBuckets());
  }

  @Override
  protected void update(AverageBufferAggregate aggregate, int bucket, double value) {
    aggregate.accumulate(bucket, value);
  }

  @Override
  public AverageBufferAggregate combine(
      AverageBufferAggregate first, AverageBufferAggregate second) {
    return AverageBufferAggregate.merge(first, second);
  }
}
