/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.chunk;

import java.util.Arrays;

/** {@link RowReader} over an array of boxed values. */
public class ArrayRowReader implements RowReader {

  private final Object[] values;

  public ArrayRowReader(Object[] values) {
    this.values = values;
  }

  @Override
  public boolean notNull(int columnNo) {
    return values[columnNo] != null;
  }

  @Override
  public int getInt(int columnNo) {
    return ((Number) values[columnNo]).intValue();
  }

  @Override
  public long getLong(int columnNo) {
    return ((Number) values[columnNo]).longValue();
  }

  @Override
  public double getDouble(int columnNo) {
    return ((Number) values[columnNo]).doubleValue();
  }

  @Override
  public String getString(int columnNo) {
    Object value = values[columnNo];
    return value == null ? null : value.toString();
  }

  @Override
  public Object getAny(int columnNo) {
    return values[columnNo];
  }

  @Override
  public String toString() {
    return "ArrayRowReader" + Arrays.toString(values);
  }
}
