/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.query;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.aggregate.Aggregate;
import org.opensearch.tsquery.aggregate.Aggregator;
import org.opensearch.tsquery.chunk.ChunkScanMethod;
import org.opensearch.tsquery.chunk.TimeSeriesPartition;
import org.opensearch.tsquery.function.AggregationFunction;
import org.opensearch.tsquery.function.Validated;
import org.opensearch.tsquery.metadata.Projection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one aggregation over a set of partitions: every partition is folded into its own fresh
 * aggregate and the per-partition results are merged with {@link Aggregator#combine}.
 *
 * <p>A partition that fails to read fails the whole aggregation with an {@link
 * AggregationException}. Nothing is retried here.
 */
@Log4j2
public class PartitionAggregationRunner {

  private final int parallelism;

  public PartitionAggregationRunner(QueryConfig queryConfig) {
    Preconditions.checkArgument(queryConfig.getParallelism() > 0, "parallelism must be positive");
    this.parallelism = queryConfig.getParallelism();
  }

  /**
   * Validates a function call and, if it is valid, aggregates the partitions with it. No chunk is
   * read when validation fails. Chunks are selected with the aggregator's own scan if it has one,
   * otherwise all chunks are read.
   *
   * @param functionName name of the aggregation function
   * @param args raw function arguments
   * @param projection columns of the queried dataset
   * @param partitions partitions selected by the query
   * @return the merged aggregate, or the validation failure
   */
  public Validated<Aggregate<?>> execute(
      String functionName,
      List<String> args,
      Projection projection,
      List<? extends TimeSeriesPartition> partitions) {
    Validated<Aggregator<?>> aggregator =
        AggregationFunction.resolve(functionName, args, projection);
    return aggregator.map(
        bound -> {
          ChunkScanMethod method = bound.chunkScan(projection).orElse(ChunkScanMethod.all());
          return aggregate(bound, partitions, method);
        });
  }

  /**
   * Aggregates partitions one after another on the calling thread.
   *
   * @return merged aggregate; the empty aggregate if there are no partitions
   */
  public <A extends Aggregate<?>> A aggregate(
      Aggregator<A> aggregator,
      List<? extends TimeSeriesPartition> partitions,
      ChunkScanMethod method) {
    A result = aggregator.emptyAggregate();
    for (TimeSeriesPartition partition : partitions) {
      A partial;
      try {
        partial = aggregator.aggPartition(method, partition);
      } catch (RuntimeException e) {
        log.error("Aggregation of partition {} failed", partition.getPartitionKey(), e);
        throw new AggregationException(partition.getPartitionKey(), e);
      }
      result = aggregator.combine(result, partial);
    }
    log.debug("Aggregated {} partitions into {}", partitions.size(), result);
    return result;
  }

  /**
   * Aggregates partitions concurrently, streaming each partition's chunks. The order in which
   * partial results are combined is not defined.
   *
   * @return merged aggregate; the empty aggregate if there are no partitions
   */
  public <A extends Aggregate<?>> Mono<A> aggregateAsync(
      Aggregator<A> aggregator,
      List<? extends TimeSeriesPartition> partitions,
      ChunkScanMethod method) {
    log.info("Aggregating {} partitions with parallelism {}", partitions.size(), parallelism);
    return Flux.fromIterable(partitions)
        .parallel(parallelism)
        .runOn(Schedulers.parallel())
        .flatMap(
            partition ->
                aggregator
                    .aggPartitionStream(method, partition)
                    .onErrorMap(
                        e -> !(e instanceof AggregationException),
                        e -> new AggregationException(partition.getPartitionKey(), e)))
        .sequential()
        .reduce(aggregator::combine)
        .switchIfEmpty(Mono.fromSupplier(aggregator::emptyAggregate))
        .doOnError(e -> log.error("Parallel aggregation failed", e));
  }
}
