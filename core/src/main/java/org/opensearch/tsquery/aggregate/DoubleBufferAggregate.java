/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import com.google.common.primitives.Doubles;
import java.util.Arrays;
import java.util.List;

/** Buffer of doubles, every slot initialized to the same starting value. */
public final class DoubleBufferAggregate extends BufferAggregate<Double> {

  private final double[] values;

  public DoubleBufferAggregate(int size, double initialValue) {
    this.values = new double[size];
    Arrays.fill(values, initialValue);
  }

  public double get(int slot) {
    return values[slot];
  }

  public void set(int slot, double value) {
    values[slot] = value;
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public List<Double> getResult() {
    return List.copyOf(Doubles.asList(values));
  }

  @Override
  public Class<Double> getValueClass() {
    return Double.class;
  }
}
