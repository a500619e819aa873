/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import com.google.common.collect.Sets;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.opensearch.tsquery.aggregate.Aggregator;
import org.opensearch.tsquery.metadata.Column;
import org.opensearch.tsquery.metadata.ColumnType;
import org.opensearch.tsquery.metadata.Projection;

/**
 * Five arguments: {@code <timeColumn> <valueColumn> <startTs> <endTs> <numBuckets>}. The time
 * column must be a LONG or TIMESTAMP column. {@code startTs} and {@code endTs} are millis since
 * epoch or ISO-8601 date-times.
 */
class TimeGroupingShape implements ArgumentShape {

  private static final Set<ColumnType> TIME_TYPES =
      Sets.immutableEnumSet(EnumSet.of(ColumnType.LONG, ColumnType.TIMESTAMP));

  /** Creates the aggregator once all arguments are valid. */
  @FunctionalInterface
  interface AggregatorFactory {
    Aggregator<?> create(
        int timeColIndex, int valueColIndex, long startTs, long endTs, int numBuckets);
  }

  private final Set<ColumnType> allowedTypes;
  private final AggregatorFactory aggregatorFactory;

  TimeGroupingShape(Set<ColumnType> allowedTypes, AggregatorFactory aggregatorFactory) {
    this.allowedTypes = Sets.immutableEnumSet(allowedTypes);
    this.aggregatorFactory = aggregatorFactory;
  }

  @Override
  public Validated<Aggregator<?>> validate(List<String> args, Projection projection) {
    return FunctionArguments.validateNumArgs(args, 5).flatMap(valid -> bind(valid, projection));
  }

  /** Each step runs only if every step before it succeeded. */
  private Validated<Aggregator<?>> bind(List<String> args, Projection projection) {
    Validated<Column> timeCol = FunctionArguments.typedColumn(args, 0, projection, TIME_TYPES);
    Validated<Column> valueCol =
        timeCol.flatMap(ok -> FunctionArguments.typedColumn(args, 1, projection, allowedTypes));
    Validated<Long> startTs = valueCol.flatMap(ok -> FunctionArguments.timestamp(args, 2));
    Validated<Long> endTs = startTs.flatMap(start -> endAfter(args, start));
    Validated<Integer> numBuckets = endTs.flatMap(ok -> FunctionArguments.nonNegativeInt(args, 4));
    return numBuckets.map(
        buckets ->
            aggregatorFactory.create(
                timeCol.get().getIndex(),
                valueCol.get().getIndex(),
                startTs.get(),
                endTs.get(),
                buckets));
  }

  private static Validated<Long> endAfter(List<String> args, long startTs) {
    return FunctionArguments.timestamp(args, 3)
        .flatMap(
            endTs ->
                endTs > startTs
                    ? Validated.<Long>valid(endTs)
                    : Validated.<Long>invalid(
                        InvalidFunctionSpec.badArgument(
                            3, "end " + endTs + " must be after start " + startTs)));
  }
}
