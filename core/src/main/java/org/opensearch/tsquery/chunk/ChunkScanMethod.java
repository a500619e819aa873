/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Selects which chunks of a partition a scan reads. */
public abstract class ChunkScanMethod {

  private static final ChunkScanMethod ALL = new AllChunkScan();

  /** Returns true if the chunk described by {@code info} is part of this scan. */
  public abstract boolean includes(ChunkSetInfo info);

  /** Scan every chunk of the partition. */
  public static ChunkScanMethod all() {
    return ALL;
  }

  /** Scan the chunks whose rows overlap the inclusive range [startTime, endTime]. */
  public static ChunkScanMethod timeRange(long startTime, long endTime) {
    return new TimeRangeChunkScan(startTime, endTime);
  }

  @ToString
  static final class AllChunkScan extends ChunkScanMethod {
    @Override
    public boolean includes(ChunkSetInfo info) {
      return true;
    }
  }

  @Getter
  @EqualsAndHashCode(callSuper = false)
  @ToString
  public static final class TimeRangeChunkScan extends ChunkScanMethod {
    private final long startTime;
    private final long endTime;

    TimeRangeChunkScan(long startTime, long endTime) {
      Preconditions.checkArgument(
          startTime <= endTime, "Scan start %s is after end %s", startTime, endTime);
      this.startTime = startTime;
      this.endTime = endTime;
    }

    @Override
    public boolean includes(ChunkSetInfo info) {
      return info.intersects(startTime, endTime);
    }
  }
}
