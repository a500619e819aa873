/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.math.BigInteger;
import java.util.Iterator;
import lombok.Getter;
import org.opensearch.tsquery.chunk.ChunkSetReader;
import org.opensearch.tsquery.chunk.RowReader;

/**
 * Splits [startTs, endTs] into {@code numBuckets} equal time buckets and reduces the values of
 * each bucket independently. Rows are read as (timestamp, value) pairs. A timestamp outside the
 * range is clamped into the first or last bucket, so every chunk of the partition is read.
 */
@Getter
public abstract class TimeGroupingAggregator<A extends BufferAggregate<Double>>
    extends ChunkAggregator<A> {

  private final int timeColIndex;
  private final int valueColIndex;
  private final long startTs;
  private final long endTs;
  private final int numBuckets;

  protected TimeGroupingAggregator(
      int timeColIndex, int valueColIndex, long startTs, long endTs, int numBuckets) {
    Preconditions.checkArgument(
        endTs > startTs, "endTs %s must be after startTs %s", endTs, startTs);
    Preconditions.checkArgument(numBuckets >= 0, "numBuckets must not be negative");
    this.timeColIndex = timeColIndex;
    this.valueColIndex = valueColIndex;
    this.startTs = startTs;
    this.endTs = endTs;
    this.numBuckets = numBuckets;
  }

  /** Folds one value into a bucket of the aggregate. */
  protected abstract void update(A aggregate, int bucket, double value);

  @Override
  public int[] positions() {
    return new int[] {timeColIndex, valueColIndex};
  }

  @Override
  protected A add(A orig, ChunkSetReader reader) {
    if (numBuckets == 0) {
      return orig;
    }
    Iterator<RowReader> rows = reader.rowIterator();
    while (rows.hasNext()) {
      RowReader row = rows.next();
      if (row.notNull(0) && row.notNull(1)) {
        double value = row.getDouble(1);
        if (!Double.isNaN(value)) {
          update(orig, bucketOf(row.getLong(0)), value);
        }
      }
    }
    return orig;
  }

  /** Returns {@code floor((timestamp - startTs) * numBuckets / (endTs - startTs))}, clamped. */
  @VisibleForTesting
  int bucketOf(long timestamp) {
    if (timestamp <= startTs) {
      return 0;
    }
    if (timestamp >= endTs) {
      return numBuckets - 1;
    }
    long span = endTs - startTs;
    long offset = timestamp - startTs;
    if (span > 0 && Math.multiplyHigh(offset, numBuckets) == 0 && offset * numBuckets >= 0) {
      return (int) (offset * numBuckets / span);
    }
    // offset * numBuckets or the span itself does not fit in a long
    return BigInteger.valueOf(timestamp)
        .subtract(BigInteger.valueOf(startTs))
        .multiply(BigInteger.valueOf(numBuckets))
        .divide(BigInteger.valueOf(endTs).subtract(BigInteger.valueOf(startTs)))
        .intValueExact();
  }
}
