/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import org.opensearch.tsquery.aggregate.Aggregator;
import org.opensearch.tsquery.metadata.ColumnType;
import org.opensearch.tsquery.metadata.Projection;

/** One argument: the name of a column whose type is one of the allowed types. */
class SingleColumnShape implements ArgumentShape {

  private final Set<ColumnType> allowedTypes;
  private final BiFunction<Integer, ColumnType, Aggregator<?>> aggregatorFactory;

  SingleColumnShape(
      Set<ColumnType> allowedTypes,
      BiFunction<Integer, ColumnType, Aggregator<?>> aggregatorFactory) {
    this.allowedTypes = Sets.immutableEnumSet(allowedTypes);
    this.aggregatorFactory = aggregatorFactory;
  }

  @Override
  public Validated<Aggregator<?>> validate(List<String> args, Projection projection) {
    return FunctionArguments.validateNumArgs(args, 1)
        .flatMap(valid -> FunctionArguments.typedColumn(valid, 0, projection, allowedTypes))
        .map(column -> aggregatorFactory.apply(column.getIndex(), column.getColumnType()));
  }
}
