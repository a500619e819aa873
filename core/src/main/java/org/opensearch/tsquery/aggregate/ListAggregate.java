/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;

/** Immutable ordered list of values. Concatenation returns a new instance. */
@EqualsAndHashCode(callSuper = false)
public final class ListAggregate<R> extends Aggregate<R> {

  private final ImmutableList<R> values;
  private final Class<R> valueClass;

  private ListAggregate(ImmutableList<R> values, Class<R> valueClass) {
    this.values = values;
    this.valueClass = valueClass;
  }

  public static <R> ListAggregate<R> empty(Class<R> valueClass) {
    return new ListAggregate<>(ImmutableList.of(), valueClass);
  }

  public static <R> ListAggregate<R> of(Class<R> valueClass, List<R> values) {
    return new ListAggregate<>(ImmutableList.copyOf(values), valueClass);
  }

  /** Returns a new aggregate with the values of {@code other} appended to this one's. */
  public ListAggregate<R> add(ListAggregate<R> other) {
    return new ListAggregate<>(
        ImmutableList.<R>builderWithExpectedSize(values.size() + other.values.size())
            .addAll(values)
            .addAll(other.values)
            .build(),
        valueClass);
  }

  @Override
  public List<R> getResult() {
    return values;
  }

  @Override
  public Class<R> getValueClass() {
    return valueClass;
  }
}
