/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.metadata;

import lombok.Value;

/** A data column of a projection: its position, name and storage type. */
@Value
public class Column {

  /** Position of the column within the projection. */
  int index;

  String name;

  ColumnType columnType;
}
