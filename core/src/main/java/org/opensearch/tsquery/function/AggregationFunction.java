/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import com.google.common.collect.ImmutableMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.aggregate.Aggregator;
import org.opensearch.tsquery.aggregate.CountingAggregator;
import org.opensearch.tsquery.aggregate.PartitionKeysAggregator;
import org.opensearch.tsquery.aggregate.SumDoublesAggregator;
import org.opensearch.tsquery.aggregate.TimeGroupingAvgDoubleAggregator;
import org.opensearch.tsquery.aggregate.TimeGroupingMaxDoubleAggregator;
import org.opensearch.tsquery.aggregate.TimeGroupingMinDoubleAggregator;
import org.opensearch.tsquery.metadata.ColumnType;
import org.opensearch.tsquery.metadata.Projection;

/**
 * The aggregation functions a query may call. Each function validates its string arguments against
 * the query's projection and, if they are valid, binds them into an {@link Aggregator}.
 *
 * <p>A function is called by its name in lower snake case, e.g. {@code time_group_avg}; lookup
 * ignores case.
 */
@Log4j2
public enum AggregationFunction {

  /** Keys of all partitions the query touches. Takes no arguments. */
  PARTITION_KEYS((args, projection) -> Validated.valid(new PartitionKeysAggregator())),

  /** {@code sum <doubleColumn>} */
  SUM(
      new SingleColumnShape(
          EnumSet.of(ColumnType.DOUBLE), (index, type) -> new SumDoublesAggregator(index))),

  /** {@code count <column>}: number of non-null values, any column type. */
  COUNT(
      new SingleColumnShape(
          EnumSet.allOf(ColumnType.class), (index, type) -> new CountingAggregator(index))),

  /** {@code time_group_min <timeColumn> <doubleColumn> <startTs> <endTs> <numBuckets>} */
  TIME_GROUP_MIN(
      new TimeGroupingShape(
          EnumSet.of(ColumnType.DOUBLE), TimeGroupingMinDoubleAggregator::new)),

  TIME_GROUP_MAX(
      new TimeGroupingShape(
          EnumSet.of(ColumnType.DOUBLE), TimeGroupingMaxDoubleAggregator::new)),

  TIME_GROUP_AVG(
      new TimeGroupingShape(
          EnumSet.of(ColumnType.DOUBLE), TimeGroupingAvgDoubleAggregator::new));

  private static final ImmutableMap<String, AggregationFunction> BY_NAME;

  static {
    ImmutableMap.Builder<String, AggregationFunction> builder = ImmutableMap.builder();
    for (AggregationFunction function : values()) {
      builder.put(function.getName(), function);
    }
    BY_NAME = builder.buildOrThrow();
  }

  private final ArgumentShape shape;

  AggregationFunction(ArgumentShape shape) {
    this.shape = shape;
  }

  /** Returns the name queries call this function by. */
  public String getName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Validates arguments against a projection.
   *
   * @param args raw arguments, in call order
   * @param projection columns of the queried dataset
   * @return the bound aggregator, or the first validation failure
   */
  public Validated<Aggregator<?>> validate(List<String> args, Projection projection) {
    Validated<Aggregator<?>> result = shape.validate(args, projection);
    if (!result.isValid()) {
      log.debug("Rejected {}{}: {}", getName(), args, result.getError().getMessage());
    }
    return result;
  }

  /** Finds a function by name, ignoring case. */
  public static Optional<AggregationFunction> withName(String name) {
    return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
  }

  /**
   * Looks up a function by name and validates the arguments of the call.
   *
   * @return the bound aggregator, or a failure if the function is unknown or the arguments are
   *     invalid
   */
  public static Validated<Aggregator<?>> resolve(
      String name, List<String> args, Projection projection) {
    return withName(name)
        .map(function -> function.validate(args, projection))
        .orElseGet(() -> Validated.invalid(InvalidFunctionSpec.noSuchFunction(name)));
  }
}
