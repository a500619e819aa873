/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.coordinator.plan.logical;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/** Matches series whose {@code column} compares to {@code value} with {@code operator}. */
@Value
public class ColumnFilter {

  @NonNull String column;
  @NonNull FilterOperator operator;
  @NonNull String value;

  public static ColumnFilter equalTo(String column, String value) {
    return new ColumnFilter(column, FilterOperator.EQUALS, value);
  }

  @Getter
  @RequiredArgsConstructor
  public enum FilterOperator {
    EQUALS("="),
    NOT_EQUALS("!="),
    REGEX_MATCH("=~"),
    NOT_REGEX_MATCH("!~");

    private final String symbol;
  }
}
