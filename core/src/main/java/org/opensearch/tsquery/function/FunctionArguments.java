/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.function;

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.metadata.Column;
import org.opensearch.tsquery.metadata.ColumnType;
import org.opensearch.tsquery.metadata.Projection;

/** Validation steps shared by the aggregation function shapes. */
@Log4j2
final class FunctionArguments {

  private FunctionArguments() {}

  static Validated<List<String>> validateNumArgs(List<String> args, int expected) {
    if (args.size() != expected) {
      return Validated.invalid(InvalidFunctionSpec.wrongNumberOfArgs(args.size(), expected));
    }
    return Validated.valid(args);
  }

  /** Resolves argument {@code argIndex} as a column name whose type is in {@code allowedTypes}. */
  static Validated<Column> typedColumn(
      List<String> args, int argIndex, Projection projection, Set<ColumnType> allowedTypes) {
    String name = args.get(argIndex);
    return projection
        .findColumn(name)
        .map(Validated::valid)
        .orElseGet(() -> Validated.invalid(InvalidFunctionSpec.noSuchColumn(argIndex, name)))
        .flatMap(column -> checkColumnType(argIndex, column, allowedTypes));
  }

  private static Validated<Column> checkColumnType(
      int argIndex, Column column, Set<ColumnType> allowedTypes) {
    if (!allowedTypes.contains(column.getColumnType())) {
      return Validated.invalid(
          InvalidFunctionSpec.wrongColumnType(
              argIndex, column.getName(), column.getColumnType(), allowedTypes));
    }
    return Validated.valid(column);
  }

  /**
   * Parses argument {@code argIndex} as milliseconds since epoch. Accepts a plain long or an
   * ISO-8601 date-time; a date-time without an offset is read as UTC.
   */
  static Validated<Long> timestamp(List<String> args, int argIndex) {
    String arg = args.get(argIndex).trim();
    return parseEpochMillis(arg)
        .map(Validated::valid)
        .orElseGet(
            () ->
                Validated.invalid(
                    InvalidFunctionSpec.badArgument(
                        argIndex,
                        "'" + arg + "' is neither epoch millis nor an ISO-8601 date-time")));
  }

  /** Parses argument {@code argIndex} as an int that is zero or greater. */
  static Validated<Integer> nonNegativeInt(List<String> args, int argIndex) {
    String arg = args.get(argIndex).trim();
    Integer value = Ints.tryParse(arg);
    if (value == null) {
      return Validated.invalid(
          InvalidFunctionSpec.badArgument(argIndex, "'" + arg + "' is not an integer"));
    }
    if (value < 0) {
      return Validated.invalid(
          InvalidFunctionSpec.badArgument(argIndex, "'" + arg + "' must not be negative"));
    }
    return Validated.valid(value);
  }

  private static Optional<Long> parseEpochMillis(String arg) {
    Long millis = Longs.tryParse(arg);
    if (millis != null) {
      return Optional.of(millis);
    }
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(
              arg, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime) {
        return Optional.of(((OffsetDateTime) parsed).toInstant().toEpochMilli());
      }
      return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC).toEpochMilli());
    } catch (DateTimeParseException e) {
      log.debug("Could not parse '{}' as a timestamp: {}", arg, e.getMessage());
      return Optional.empty();
    }
  }
}
