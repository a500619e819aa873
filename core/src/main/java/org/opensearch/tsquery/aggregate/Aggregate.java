/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.aggregate;

import java.util.List;

/**
 * Holds the intermediate or final values computed by an {@link Aggregator}. Aggregates come in
 * three shapes:
 *
 * <ul>
 *   <li>{@link ScalarAggregate}: a single immutable value
 *   <li>{@link BufferAggregate}: a pre-sized mutable buffer updated in place while one partition
 *       is scanned
 *   <li>{@link ListAggregate}: an immutable ordered list, used for identifier-like results
 * </ul>
 *
 * @param <R> type of the result values
 */
public abstract class Aggregate<R> {

  /** Returns the values of this aggregate. The returned list is a snapshot. */
  public abstract List<R> getResult();

  /** Returns the runtime class of the result values. */
  public abstract Class<R> getValueClass();

  @Override
  public String toString() {
    return getClass().getSimpleName() + getResult();
  }
}
