/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.opensearch.tsquery.TestData.START;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.TestData;
import reactor.test.StepVerifier;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class MemoryTimeSeriesPartitionTest {

  private static final int[] TIME_AND_VALUE = {TestData.TS, TestData.VAL};

  private MemoryTimeSeriesPartition partition;

  @BeforeEach
  void setUp() {
    // 40 rows, one per second, 10 rows per chunk
    partition = TestData.partition("series-1", 40);
  }

  @Test
  void should_read_only_chunks_overlapping_the_time_range() {
    ChunkScanMethod scan = ChunkScanMethod.timeRange(START, START + 20000 - 100);

    List<ChunkSetReader> readers = partition.readers(scan, TIME_AND_VALUE);

    assertEquals(2, readers.size());
    assertEquals(20, readers.stream().mapToInt(ChunkSetReader::rowCount).sum());
    List<Object> expected = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      expected.add(List.of(START + i * 1000L, (double) i));
    }
    assertEquals(expected, tuples(readers));
  }

  @Test
  void should_read_all_chunks() {
    List<ChunkSetReader> readers = partition.readers(ChunkScanMethod.all(), TIME_AND_VALUE);

    assertEquals(4, readers.size());
    assertEquals(40, tuples(readers).size());
    assertEquals(List.of(0L, 1L, 2L, 3L), readers.stream().map(r -> r.getInfo().getId()).toList());
  }

  @Test
  void should_stream_the_same_chunks_as_the_bulk_read() {
    ChunkScanMethod scan = ChunkScanMethod.timeRange(START, START + 20000 - 100);

    StepVerifier.create(partition.streamReaders(scan, TIME_AND_VALUE))
        .expectNextCount(2)
        .verifyComplete();

    List<ChunkSetReader> streamed =
        partition.streamReaders(scan, TIME_AND_VALUE).collectList().block();
    assertEquals(tuples(partition.readers(scan, TIME_AND_VALUE)), tuples(streamed));
  }

  @Test
  void should_deliver_streamed_chunks_on_demand() {
    StepVerifier.create(partition.streamReaders(ChunkScanMethod.all(), TIME_AND_VALUE), 1)
        .expectNextCount(1)
        .thenRequest(3)
        .expectNextCount(3)
        .verifyComplete();
  }

  @Test
  void should_include_unsealed_rows() {
    partition.ingest(START + 40_000L, 40.0, "host-1");
    partition.ingest(START + 41_000L, 41.0, "host-2");

    List<ChunkSetReader> readers = partition.readers(ChunkScanMethod.all(), TIME_AND_VALUE);

    assertEquals(5, partition.numChunks());
    assertEquals(5, readers.size());
    ChunkSetInfo last = readers.get(4).getInfo();
    assertEquals(2, last.getNumRows());
    assertEquals(START + 40_000L, last.getStartTime());
    assertEquals(START + 41_000L, last.getEndTime());
  }

  @Test
  void should_restrict_rows_to_requested_positions() {
    List<ChunkSetReader> readers =
        partition.readers(ChunkScanMethod.all(), new int[] {TestData.HOST, TestData.VAL});

    RowReader first = readers.get(0).rowIterator().next();
    assertEquals("host-0", first.getString(0));
    assertEquals(0.0, first.getDouble(1));
  }

  @Test
  void should_report_missing_values() {
    MemoryTimeSeriesPartition sparse =
        new MemoryTimeSeriesPartition("sparse", TestData.PROJECTION, "ts", 10);
    sparse.ingest(START, null, "host-0");

    RowReader row =
        sparse.readers(ChunkScanMethod.all(), TIME_AND_VALUE).get(0).rowIterator().next();

    assertFalse(row.notNull(1));
    assertNull(row.getAny(1));
  }

  @Test
  void should_return_fresh_row_iterators() {
    ChunkSetReader reader = partition.readers(ChunkScanMethod.all(), TIME_AND_VALUE).get(0);

    assertEquals(10, ImmutableList.copyOf(reader.rowIterator()).size());
    assertEquals(10, ImmutableList.copyOf(reader.rowIterator()).size());
  }

  @Test
  void should_reject_invalid_rows_and_positions() {
    assertThrows(IllegalArgumentException.class, () -> partition.ingest(START, 1.0));
    assertThrows(
        IllegalArgumentException.class, () -> partition.ingest("not-a-time", 1.0, "host-0"));
    assertThrows(
        IndexOutOfBoundsException.class,
        () -> partition.readers(ChunkScanMethod.all(), new int[] {3}));
  }

  @Test
  void should_reject_rows_out_of_timestamp_order() {
    MemoryTimeSeriesPartition series =
        new MemoryTimeSeriesPartition("series", TestData.PROJECTION, "ts", 4);
    series.ingest(START + 1000L, 1.0, "host");
    series.ingest(START + 1000L, 2.0, "host");

    assertThrows(IllegalArgumentException.class, () -> series.ingest(START, 3.0, "host"));
    assertEquals(1, series.numChunks());
  }

  @Test
  void should_require_a_time_column() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new MemoryTimeSeriesPartition("p", TestData.PROJECTION, "val", 10));
    assertThrows(
        IllegalArgumentException.class,
        () -> new MemoryTimeSeriesPartition("p", TestData.PROJECTION, "missing", 10));
  }

  private static List<Object> tuples(List<ChunkSetReader> readers) {
    List<Object> tuples = new ArrayList<>();
    for (ChunkSetReader reader : readers) {
      Iterator<RowReader> rows = reader.rowIterator();
      while (rows.hasNext()) {
        RowReader row = rows.next();
        tuples.add(List.of(row.getLong(0), row.getDouble(1)));
      }
    }
    return tuples;
  }
}
