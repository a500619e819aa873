/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import lombok.Value;

/** Metadata for one chunk set: its id, row count and the time span of its rows. */
@Value
public class ChunkSetInfo {

  long id;

  int numRows;

  /** Smallest timestamp in the chunk, inclusive. */
  long startTime;

  /** Largest timestamp in the chunk, inclusive. */
  long endTime;

  /** Returns true if any part of this chunk falls within [start, end]. */
  public boolean intersects(long start, long end) {
    return startTime <= end && endTime >= start;
  }
}
