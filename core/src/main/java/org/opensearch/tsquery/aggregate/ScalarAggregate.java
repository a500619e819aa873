/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.List;
import lombok.EqualsAndHashCode;

/** Immutable aggregate holding exactly one value. */
@EqualsAndHashCode(callSuper = false)
public class ScalarAggregate<R> extends Aggregate<R> {

  private final R value;
  private final Class<R> valueClass;

  public ScalarAggregate(R value, Class<R> valueClass) {
    this.value = value;
    this.valueClass = valueClass;
  }

  public R getValue() {
    return value;
  }

  @Override
  public List<R> getResult() {
    return List.of(value);
  }

  @Override
  public Class<R> getValueClass() {
    return valueClass;
  }
}
