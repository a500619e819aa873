/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Per-slot running averages. Sums and counts are kept separately so that two partial averages can
 * be merged exactly. Slots without any value report NaN.
 */
public final class AverageBufferAggregate extends BufferAggregate<Double> {

  private final double[] sums;
  private final long[] counts;

  public AverageBufferAggregate(int size) {
    this.sums = new double[size];
    this.counts = new long[size];
  }

  /** Adds one value to a slot. */
  public void accumulate(int slot, double value) {
    sums[slot] += value;
    counts[slot]++;
  }

  /** Adds a partial sum and count to a slot. */
  public void accumulate(int slot, double sum, long count) {
    sums[slot] += sum;
    counts[slot] += count;
  }

  public double getSum(int slot) {
    return sums[slot];
  }

  public long getCount(int slot) {
    return counts[slot];
  }

  /**
   * Returns a new buffer holding the slot-wise totals of both buffers. Neither input is modified.
   */
  public static AverageBufferAggregate merge(
      AverageBufferAggregate first, AverageBufferAggregate second) {
    Preconditions.checkArgument(
        first.size() == second.size(),
        "Cannot merge buffers of size %s and %s",
        first.size(),
        second.size());
    AverageBufferAggregate merged = new AverageBufferAggregate(first.size());
    for (int i = 0; i < first.size(); i++) {
      merged.sums[i] = first.sums[i] + second.sums[i];
      merged.counts[i] = first.counts[i] + second.counts[i];
    }
    return merged;
  }

  @Override
  public int size() {
    return sums.length;
  }

  @Override
  public List<Double> getResult() {
    ImmutableList.Builder<Double> result = ImmutableList.builderWithExpectedSize(sums.length);
    for (int i = 0; i < sums.length; i++) {
      result.add(counts[i] == 0 ? Double.NaN : sums[i] / counts[i]);
    }
    return result.build();
  }

  @Override
  public Class<Double> getValueClass() {
    return Double.class;
  }
}
