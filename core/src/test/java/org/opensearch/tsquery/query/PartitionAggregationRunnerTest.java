/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.opensearch.tsquery.TestData.PROJECTION;
import static org.opensearch.tsquery.TestData.VAL;
import static org.opensearch.tsquery.TestData.partition;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.tsquery.aggregate.Aggregate;
import org.opensearch.tsquery.aggregate.DoubleAggregate;
import org.opensearch.tsquery.aggregate.DoubleBufferAggregate;
import org.opensearch.tsquery.aggregate.SumDoublesAggregator;
import org.opensearch.tsquery.aggregate.TimeGroupingMaxDoubleAggregator;
import org.opensearch.tsquery.chunk.ChunkScanMethod;
import org.opensearch.tsquery.chunk.MemoryTimeSeriesPartition;
import org.opensearch.tsquery.chunk.TimeSeriesPartition;
import org.opensearch.tsquery.function.InvalidFunctionSpec;
import org.opensearch.tsquery.function.Validated;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
@ExtendWith(MockitoExtension.class)
class PartitionAggregationRunnerTest {

  @Mock private TimeSeriesPartition brokenPartition;

  private PartitionAggregationRunner runner;

  private List<TimeSeriesPartition> partitions;

  @BeforeEach
  void setUp() {
    runner = new PartitionAggregationRunner(QueryConfig.builder().parallelism(4).build());
    // 0..39, 100..139 and 200..219
    partitions =
        List.of(partition("a", 40), partition("b", 40, 100.0), partition("c", 20, 200.0));
  }

  @Test
  void should_sum_every_partition() {
    DoubleAggregate sum =
        runner.aggregate(new SumDoublesAggregator(VAL), partitions, ChunkScanMethod.all());

    assertEquals(780.0 + 4780.0 + 4190.0, sum.doubleValue());
  }

  @Test
  void should_give_the_same_result_sequentially_and_concurrently() {
    TimeGroupingMaxDoubleAggregator aggregator =
        new TimeGroupingMaxDoubleAggregator(0, VAL, 1000L, 41000L, 8);

    DoubleBufferAggregate sequential =
        runner.aggregate(aggregator, partitions, ChunkScanMethod.all());

    StepVerifier.create(runner.aggregateAsync(aggregator, partitions, ChunkScanMethod.all()))
        .assertNext(concurrent -> assertEquals(sequential.getResult(), concurrent.getResult()))
        .verifyComplete();
  }

  @Test
  void should_return_the_empty_aggregate_without_partitions() {
    SumDoublesAggregator aggregator = new SumDoublesAggregator(VAL);

    assertEquals(0.0, runner.aggregate(aggregator, List.of(), ChunkScanMethod.all()).doubleValue());
    StepVerifier.create(runner.aggregateAsync(aggregator, List.of(), ChunkScanMethod.all()))
        .assertNext(empty -> assertEquals(0.0, empty.doubleValue()))
        .verifyComplete();
  }

  @Test
  void should_execute_a_function_call() {
    Validated<Aggregate<?>> result =
        runner.execute(
            "time_group_max", List.of("ts", "val", "1000", "10500", "2"), PROJECTION, partitions);

    assertTrue(result.isValid());
    // rows after 10500 are clamped into the last bucket
    assertEquals(List.of(204.0, 219.0), result.get().getResult());
  }

  @Test
  void should_give_the_same_result_for_any_chunk_size() {
    List<String> args = List.of("ts", "val", "5000", "9000", "1");

    for (int chunkSize : new int[] {1, 4, 10}) {
      MemoryTimeSeriesPartition series =
          new MemoryTimeSeriesPartition("series", PROJECTION, "ts", chunkSize);
      for (int i = 0; i < 10; i++) {
        series.ingest(i * 1000L, (double) i, "host");
      }

      Validated<Aggregate<?>> min =
          runner.execute("time_group_min", args, PROJECTION, List.of(series));

      assertEquals(List.of(0.0), min.get().getResult(), "chunk size " + chunkSize);
    }
  }

  @Test
  void should_list_partition_keys() {
    Validated<Aggregate<?>> result =
        runner.execute("partition_keys", List.of(), PROJECTION, partitions);

    assertEquals(List.of("a", "b", "c"), result.get().getResult());
  }

  @Test
  void should_not_read_any_chunk_when_the_call_is_invalid() {
    Validated<Aggregate<?>> result =
        runner.execute("sum", List.of("host"), PROJECTION, List.of(brokenPartition));

    assertEquals(InvalidFunctionSpec.Kind.WRONG_COLUMN_TYPE, result.getError().getKind());
    verifyNoInteractions(brokenPartition);
  }

  @Test
  void should_name_the_partition_that_failed() {
    IllegalStateException cause = new IllegalStateException("chunk missing");
    when(brokenPartition.getPartitionKey()).thenReturn("broken");
    when(brokenPartition.readers(any(), any())).thenThrow(cause);

    AggregationException e =
        assertThrows(
            AggregationException.class,
            () ->
                runner.aggregate(
                    new SumDoublesAggregator(VAL),
                    List.of(partitions.get(0), brokenPartition),
                    ChunkScanMethod.all()));

    assertEquals("broken", e.getPartitionKey());
    assertSame(cause, e.getCause());
    verify(brokenPartition).readers(any(), any());
  }

  @Test
  void should_fail_concurrent_aggregation_when_one_partition_fails() {
    when(brokenPartition.getPartitionKey()).thenReturn("broken");
    when(brokenPartition.streamReaders(any(), any()))
        .thenReturn(Flux.error(new IllegalStateException("chunk missing")));

    StepVerifier.create(
            runner.aggregateAsync(
                new SumDoublesAggregator(VAL),
                List.of(partitions.get(0), brokenPartition),
                ChunkScanMethod.all()))
        .expectErrorSatisfies(
            e -> {
              AggregationException failure = assertInstanceOf(AggregationException.class, e);
              assertEquals("broken", failure.getPartitionKey());
              assertInstanceOf(IllegalStateException.class, failure.getCause());
            })
        .verify();
  }

  @Test
  void should_require_positive_parallelism() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new PartitionAggregationRunner(QueryConfig.builder().parallelism(0).build()));
  }
}
