/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.metadata;

/** Storage types of the data columns in a time series dataset. */
public enum ColumnType {
  INT,
  LONG,
  DOUBLE,
  STRING,
  BITMAP,

  /** Milliseconds since epoch, stored as a long. */
  TIMESTAMP
}
