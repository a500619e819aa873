/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.Iterator;
import org.opensearch.tsquery.chunk.ChunkSetReader;
import org.opensearch.tsquery.chunk.RowReader;

/** Counts the rows in which one column has a value. Works for any column type. */
public class CountingAggregator extends ChunkAggregator<LongAggregate> {

  private static final LongAggregate ZERO = new LongAggregate(0L);

  private final int[] positions;

  public CountingAggregator(int colIndex) {
    this.positions = new int[] {colIndex};
  }

  @Override
  public int[] positions() {
    return positions.clone();
  }

  @Override
  protected LongAggregate add(LongAggregate orig, ChunkSetReader reader) {
    long count = 0;
    Iterator<RowReader> rows = reader.rowIterator();
    while (rows.hasNext()) {
      if (rows.next().notNull(0)) {
        count++;
      }
    }
    return count == 0 ? orig : new LongAggregate(orig.longValue() + count);
  }

  @Override
  public LongAggregate emptyAggregate() {
    return ZERO;
  }

  @Override
  public LongAggregate combine(LongAggregate first, LongAggregate second) {
    return new LongAggregate(first.longValue() + second.longValue());
  }
}
