/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

public final class DoubleAggregate extends ScalarAggregate<Double> implements NumericAggregate {

  public DoubleAggregate(double value) {
    super(value, Double.class);
  }

  @Override
  public double doubleValue() {
    return getValue();
  }
}
