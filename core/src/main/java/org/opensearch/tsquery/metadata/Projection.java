/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.metadata;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * The ordered set of data columns a query reads. Column indexes are assigned in declaration order
 * and are the positions aggregators bind to when reading chunks.
 */
@EqualsAndHashCode(of = "columns")
@ToString(of = "columns")
public class Projection {

  private final List<Column> columns;
  private final ImmutableMap<String, Column> columnsByName;

  private Projection(List<Column> columns) {
    this.columns = ImmutableList.copyOf(columns);
    ImmutableMap.Builder<String, Column> byName = ImmutableMap.builder();
    for (Column column : columns) {
      byName.put(column.getName(), column);
    }
    this.columnsByName = byName.buildOrThrow();
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Column> getColumns() {
    return columns;
  }

  /**
   * Looks up a column by its exact name.
   *
   * @param name column name
   * @return the column, or empty if the projection has no such column
   */
  public Optional<Column> findColumn(String name) {
    return Optional.ofNullable(columnsByName.get(name));
  }

  public Column getColumn(int index) {
    Preconditions.checkElementIndex(index, columns.size(), "column index");
    return columns.get(index);
  }

  public int size() {
    return columns.size();
  }

  /** Builds a projection, numbering columns in the order they are added. */
  public static class Builder {
    private final ImmutableList.Builder<Column> columns = ImmutableList.builder();
    private int nextIndex = 0;

    public Builder column(String name, ColumnType type) {
      columns.add(new Column(nextIndex++, name, type));
      return this;
    }

    public Projection build() {
      return new Projection(columns.build());
    }
  }
}
