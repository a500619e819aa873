/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import java.util.List;
import reactor.core.publisher.Flux;

/**
 * The chunks belonging to one time series. Both read paths enumerate the same chunks and rows for
 * the same arguments; they differ only in how the chunks are delivered.
 */
public interface TimeSeriesPartition {

  /** Returns the identifier of this time series, as reported by {@code partition_keys}. */
  String getPartitionKey();

  /**
   * Reads the selected chunks in bulk.
   *
   * @param method chunks to read
   * @param positions column positions each chunk reader is restricted to
   * @return chunk readers in row-key order
   */
  List<ChunkSetReader> readers(ChunkScanMethod method, int[] positions);

  /**
   * Reads the selected chunks lazily. Chunks are produced on demand as the subscriber requests
   * them.
   *
   * @param method chunks to read
   * @param positions column positions each chunk reader is restricted to
   * @return chunk readers in row-key order
   */
  Flux<ChunkSetReader> streamReaders(ChunkScanMethod method, int[] positions);
}
