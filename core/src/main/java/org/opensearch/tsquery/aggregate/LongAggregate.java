/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

public final class LongAggregate extends ScalarAggregate<Long> implements NumericAggregate {

  public LongAggregate(long value) {
    super(value, Long.class);
  }

  public long longValue() {
    return getValue();
  }

  @Override
  public double doubleValue() {
    return getValue();
  }
}
