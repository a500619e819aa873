/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import java.util.Set;
import lombok.Value;
import org.opensearch.tsquery.metadata.ColumnType;

/** Why a call to an aggregation function was rejected before any data was read. */
@Value
public class InvalidFunctionSpec {

  /** Value of {@link #getArgumentIndex()} when the failure is not about a single argument. */
  public static final int NO_ARGUMENT = -1;

  public enum Kind {
    WRONG_NUMBER_OF_ARGS,
    NO_SUCH_COLUMN,
    WRONG_COLUMN_TYPE,
    BAD_ARGUMENT,
    NO_SUCH_FUNCTION
  }

  Kind kind;

  /** Zero-based position of the offending argument, or {@link #NO_ARGUMENT}. */
  int argumentIndex;

  /** Column the failure is about, or null. */
  String columnName;

  String message;

  public static InvalidFunctionSpec wrongNumberOfArgs(int actual, int expected) {
    return new InvalidFunctionSpec(
        Kind.WRONG_NUMBER_OF_ARGS,
        NO_ARGUMENT,
        null,
        String.format("Wrong number of arguments: got %d, expected %d", actual, expected));
  }

  public static InvalidFunctionSpec noSuchColumn(int argumentIndex, String column) {
    return new InvalidFunctionSpec(
        Kind.NO_SUCH_COLUMN,
        argumentIndex,
        column,
        String.format("Argument %d: no such column %s", argumentIndex + 1, column));
  }

  public static InvalidFunctionSpec wrongColumnType(
      int argumentIndex, String column, ColumnType actual, Set<ColumnType> allowed) {
    return new InvalidFunctionSpec(
        Kind.WRONG_COLUMN_TYPE,
        argumentIndex,
        column,
        String.format(
            "Argument %d: column %s has type %s, allowed types are %s",
            argumentIndex + 1, column, actual, allowed));
  }

  public static InvalidFunctionSpec badArgument(int argumentIndex, String reason) {
    return new InvalidFunctionSpec(
        Kind.BAD_ARGUMENT,
        argumentIndex,
        null,
        String.format("Argument %d: %s", argumentIndex + 1, reason));
  }

  public static InvalidFunctionSpec noSuchFunction(String name) {
    return new InvalidFunctionSpec(
        Kind.NO_SUCH_FUNCTION, NO_ARGUMENT, null, "No such aggregation function " + name);
  }
}
