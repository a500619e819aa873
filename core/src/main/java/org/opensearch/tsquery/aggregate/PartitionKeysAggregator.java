/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.List;
import org.opensearch.tsquery.chunk.ChunkScanMethod;
import org.opensearch.tsquery.chunk.TimeSeriesPartition;

/**
 * Returns the key of every partition a query touches. Chunk contents are never read. Combining
 * concatenates, so the order of keys follows the order partitions were combined in.
 */
public class PartitionKeysAggregator implements Aggregator<ListAggregate<String>> {

  @Override
  public ListAggregate<String> aggPartition(
      ChunkScanMethod method, TimeSeriesPartition partition) {
    return ListAggregate.of(String.class, List.of(partition.getPartitionKey()));
  }

  @Override
  public ListAggregate<String> emptyAggregate() {
    return ListAggregate.empty(String.class);
  }

  @Override
  public ListAggregate<String> combine(ListAggregate<String> first, ListAggregate<String> second) {
    return first.add(second);
  }
}
