/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.Optional;
import org.opensearch.tsquery.chunk.ChunkScanMethod;
import org.opensearch.tsquery.chunk.TimeSeriesPartition;
import org.opensearch.tsquery.metadata.Projection;
import reactor.core.publisher.Mono;

/**
 * Computes {@link Aggregate}s from the chunks of a partition and combines them, for one bound
 * query. Aggregators are stateless and may be shared by concurrent partition scans.
 *
 * <p>{@link #combine} must be associative and commutative: chunks and partitions arrive in no
 * particular order and may be processed concurrently.
 *
 * @param <A> the aggregate type produced and combined
 */
public interface Aggregator<A extends Aggregate<?>> {

  /**
   * Computes the aggregate of one partition, reading its chunks in bulk.
   *
   * @param method chunks of the partition to read
   * @param partition the time series to read
   * @return a new aggregate owned by the caller
   */
  A aggPartition(ChunkScanMethod method, TimeSeriesPartition partition);

  /**
   * Computes the aggregate of one partition from its streamed chunks. Produces the same result as
   * {@link #aggPartition}.
   */
  default Mono<A> aggPartitionStream(ChunkScanMethod method, TimeSeriesPartition partition) {
    return Mono.fromCallable(() -> aggPartition(method, partition));
  }

  /**
   * Returns the starting aggregate for a partition. Called once per partition scan; every call
   * must return a NEW instance when the aggregate is mutable.
   */
  A emptyAggregate();

  /** Combines two aggregates of this aggregator. */
  A combine(A first, A second);

  /**
   * Returns a chunk scan that restricts the chunks read for this aggregation, if the aggregator
   * can derive one from its arguments. Skipped chunks must not be able to change the result.
   */
  default Optional<ChunkScanMethod> chunkScan(Projection projection) {
    return Optional.empty();
  }
}
