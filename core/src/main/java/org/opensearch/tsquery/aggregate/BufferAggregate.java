/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

/**
 * A fixed-length mutable aggregate, updated in place for every row of a partition scan.
 *
 * <p>A buffer is owned by the single scan that created it until it is handed to {@link
 * Aggregator#combine}. It must never be shared between partitions or between concurrent scans.
 */
public abstract class BufferAggregate<R> extends Aggregate<R> {

  /** Returns the number of slots in the buffer. */
  public abstract int size();
}
