/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.List;
import org.opensearch.tsquery.chunk.ChunkScanMethod;
import org.opensearch.tsquery.chunk.ChunkSetReader;
import org.opensearch.tsquery.chunk.TimeSeriesPartition;
import reactor.core.publisher.Mono;

/**
 * An {@link Aggregator} that folds a partition's chunks, one at a time, into the aggregate
 * returned by {@link #emptyAggregate()}.
 */
public abstract class ChunkAggregator<A extends Aggregate<?>> implements Aggregator<A> {

  /** Returns the projection column positions this aggregator reads, in reader column order. */
  public abstract int[] positions();

  /**
   * Adds the rows of one chunk to an aggregate. Buffer aggregates are updated in place and
   * returned; immutable aggregates are replaced.
   */
  protected abstract A add(A orig, ChunkSetReader reader);

  @Override
  public A aggPartition(ChunkScanMethod method, TimeSeriesPartition partition) {
    List<ChunkSetReader> readers = partition.readers(method, positions());
    A aggregate = emptyAggregate();
    for (ChunkSetReader reader : readers) {
      aggregate = add(aggregate, reader);
    }
    return aggregate;
  }

  @Override
  public Mono<A> aggPartitionStream(ChunkScanMethod method, TimeSeriesPartition partition) {
    return partition.streamReaders(method, positions()).reduceWith(this::emptyAggregate, this::add);
  }
}
