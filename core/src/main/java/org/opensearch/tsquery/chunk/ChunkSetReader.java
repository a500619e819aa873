/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import java.util.Iterator;

/**
 * Reads the rows of one chunk set, restricted to the column positions the chunk was requested
 * with.
 */
public interface ChunkSetReader {

  ChunkSetInfo getInfo();

  /** Returns a fresh iterator over the rows of this chunk in row-key order. */
  Iterator<RowReader> rowIterator();

  /** Returns the number of rows in this chunk. */
  default int rowCount() {
    return getInfo().getNumRows();
  }
}
