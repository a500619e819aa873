/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.Iterator;
import org.opensearch.tsquery.chunk.ChunkSetReader;
import org.opensearch.tsquery.chunk.RowReader;

/** Sums the non-null values of one double column. */
public class SumDoublesAggregator extends ChunkAggregator<DoubleAggregate> {

  private static final DoubleAggregate ZERO = new DoubleAggregate(0.0);

  private final int[] positions;

  public SumDoublesAggregator(int colIndex) {
    this.positions = new int[] {colIndex};
  }

  @Override
  public int[] positions() {
    return positions.clone();
  }

  @Override
  protected DoubleAggregate add(DoubleAggregate orig, ChunkSetReader reader) {
    double sum = orig.doubleValue();
    Iterator<RowReader> rows = reader.rowIterator();
    while (rows.hasNext()) {
      RowReader row = rows.next();
      if (row.notNull(0)) {
        sum += row.getDouble(0);
      }
    }
    return new DoubleAggregate(sum);
  }

  @Override
  public DoubleAggregate emptyAggregate() {
    return ZERO;
  }

  @Override
  public DoubleAggregate combine(DoubleAggregate first, DoubleAggregate second) {
    return new DoubleAggregate(first.doubleValue() + second.doubleValue());
  }
}
