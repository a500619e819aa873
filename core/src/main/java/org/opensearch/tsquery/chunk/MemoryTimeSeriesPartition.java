/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.metadata.Column;
import org.opensearch.tsquery.metadata.ColumnType;
import org.opensearch.tsquery.metadata.Projection;
import reactor.core.publisher.Flux;

/**
 * A {@link TimeSeriesPartition} held on the heap. Ingested rows accumulate in a write buffer that
 * is sealed into an immutable columnar chunk once it holds {@code maxChunkSize} rows. Reads see
 * every sealed chunk plus a snapshot of the write buffer.
 */
@Log4j2
public class MemoryTimeSeriesPartition implements TimeSeriesPartition {

  @Getter private final String partitionKey;
  private final Projection projection;
  private final int timeColumn;
  private final int maxChunkSize;

  private final List<MemoryChunk> chunks = new ArrayList<>();
  private final List<Object[]> writeBuffer = new ArrayList<>();
  private long nextChunkId = 0;
  private long lastTimestamp = Long.MIN_VALUE;

  /**
   * Creates an empty partition.
   *
   * @param partitionKey identifier of the series
   * @param projection data columns of every row
   * @param timeColumn name of the LONG or TIMESTAMP column used to select chunks by time
   * @param maxChunkSize rows per sealed chunk
   */
  public MemoryTimeSeriesPartition(
      String partitionKey, Projection projection, String timeColumn, int maxChunkSize) {
    Preconditions.checkArgument(maxChunkSize > 0, "maxChunkSize must be positive");
    Column column =
        projection
            .findColumn(timeColumn)
            .orElseThrow(() -> new IllegalArgumentException("No time column " + timeColumn));
    Preconditions.checkArgument(
        column.getColumnType() == ColumnType.LONG
            || column.getColumnType() == ColumnType.TIMESTAMP,
        "Time column %s has type %s",
        timeColumn,
        column.getColumnType());
    this.partitionKey = partitionKey;
    this.projection = projection;
    this.timeColumn = column.getIndex();
    this.maxChunkSize = maxChunkSize;
  }

  /**
   * Appends one row. Rows must arrive in timestamp order.
   *
   * @param row one value per projection column
   */
  public synchronized void ingest(Object... row) {
    Preconditions.checkArgument(
        row.length == projection.size(),
        "Row has %s values but projection has %s columns",
        row.length,
        projection.size());
    Preconditions.checkArgument(
        row[timeColumn] instanceof Number, "Row has no timestamp: %s", row[timeColumn]);
    long timestamp = ((Number) row[timeColumn]).longValue();
    Preconditions.checkArgument(
        timestamp >= lastTimestamp,
        "Row timestamp %s is before the last ingested timestamp %s",
        timestamp,
        lastTimestamp);
    writeBuffer.add(row.clone());
    lastTimestamp = timestamp;
    if (writeBuffer.size() >= maxChunkSize) {
      chunks.add(seal(writeBuffer, nextChunkId++));
      writeBuffer.clear();
    }
  }

  /** Appends rows in order. */
  public void ingestAll(List<Object[]> rows) {
    for (Object[] row : rows) {
      ingest(row);
    }
  }

  /** Returns the number of chunks a full scan would read. */
  public synchronized int numChunks() {
    return chunks.size() + (writeBuffer.isEmpty() ? 0 : 1);
  }

  @Override
  public List<ChunkSetReader> readers(ChunkScanMethod method, int[] positions) {
    checkPositions(positions);
    return snapshot().stream()
        .filter(chunk -> method.includes(chunk.info))
        .map(chunk -> chunk.reader(positions))
        .collect(Collectors.toList());
  }

  @Override
  public Flux<ChunkSetReader> streamReaders(ChunkScanMethod method, int[] positions) {
    checkPositions(positions);
    return Flux.defer(() -> Flux.fromIterable(snapshot()))
        .filter(chunk -> method.includes(chunk.info))
        .map(chunk -> chunk.reader(positions));
  }

  private synchronized List<MemoryChunk> snapshot() {
    ImmutableList.Builder<MemoryChunk> builder = ImmutableList.builder();
    builder.addAll(chunks);
    if (!writeBuffer.isEmpty()) {
      builder.add(seal(writeBuffer, nextChunkId));
    }
    return builder.build();
  }

  private MemoryChunk seal(List<Object[]> rows, long chunkId) {
    Object[][] columns = new Object[projection.size()][rows.size()];
    for (int row = 0; row < rows.size(); row++) {
      Object[] values = rows.get(row);
      for (int col = 0; col < values.length; col++) {
        columns[col][row] = values[col];
      }
    }
    long start = ((Number) rows.get(0)[timeColumn]).longValue();
    long end = ((Number) rows.get(rows.size() - 1)[timeColumn]).longValue();
    ChunkSetInfo info = new ChunkSetInfo(chunkId, rows.size(), start, end);
    log.trace("Sealed chunk {} of partition {}", info, partitionKey);
    return new MemoryChunk(info, columns);
  }

  private void checkPositions(int[] positions) {
    for (int position : positions) {
      Preconditions.checkElementIndex(position, projection.size(), "column position");
    }
  }

  /** An immutable columnar chunk. */
  private static final class MemoryChunk {
    private final ChunkSetInfo info;
    private final Object[][] columns;

    private MemoryChunk(ChunkSetInfo info, Object[][] columns) {
      this.info = info;
      this.columns = columns;
    }

    ChunkSetReader reader(int[] positions) {
      int[] projected = positions.clone();
      return new ChunkSetReader() {
        @Override
        public ChunkSetInfo getInfo() {
          return info;
        }

        @Override
        public Iterator<RowReader> rowIterator() {
          return new Iterator<>() {
            private int row = 0;

            @Override
            public boolean hasNext() {
              return row < info.getNumRows();
            }

            @Override
            public RowReader next() {
              if (!hasNext()) {
                throw new NoSuchElementException();
              }
              Object[] values = new Object[projected.length];
              for (int i = 0; i < projected.length; i++) {
                values[i] = columns[projected[i]][row];
              }
              row++;
              return new ArrayRowReader(values);
            }
          };
        }
      };
    }
  }
}
