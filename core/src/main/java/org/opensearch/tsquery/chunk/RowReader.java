/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

/**
 * Read access to one row of a chunk. Column numbers are relative to the positions the chunk was
 * read with: column 0 is the first requested position, column 1 the second, and so on.
 */
public interface RowReader {

  /** Returns true if the value in the given column is present. */
  boolean notNull(int columnNo);

  int getInt(int columnNo);

  long getLong(int columnNo);

  double getDouble(int columnNo);

  String getString(int columnNo);

  /** Returns the value in its boxed storage form, or null if absent. */
  Object getAny(int columnNo);
}
