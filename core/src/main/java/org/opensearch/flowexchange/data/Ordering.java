/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.data;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedBytes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A total order over rows given by a list of (column index, direction) pairs. Earlier columns take
 * precedence. Nulls sort first in ascending columns and last in descending ones.
 */
public final class Ordering {

  /** Direction of one ordering column. */
  public enum Direction {
    ASC,
    DESC
  }

  /** One ordering column. */
  public record Column(int columnIndex, Direction direction) {
    public Column {
      Preconditions.checkArgument(columnIndex >= 0, "columnIndex must be non-negative");
      Objects.requireNonNull(direction, "direction");
    }
  }

  private static final Ordering NONE = new Ordering(List.of());

  private final List<Column> columns;

  public Ordering(List<Column> columns) {
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
  }

  /** Returns the empty ordering, under which every pair of rows compares equal. */
  public static Ordering none() {
    return NONE;
  }

  public static Ordering asc(int... columnIndexes) {
    return of(Direction.ASC, columnIndexes);
  }

  public static Ordering desc(int... columnIndexes) {
    return of(Direction.DESC, columnIndexes);
  }

  private static Ordering of(Direction direction, int... columnIndexes) {
    List<Column> columns = new ArrayList<>(columnIndexes.length);
    for (int index : columnIndexes) {
      columns.add(new Column(index, direction));
    }
    return new Ordering(columns);
  }

  public List<Column> getColumns() {
    return columns;
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  /** Returns the largest column index referenced, or -1 for the empty ordering. */
  public int maxColumnIndex() {
    return columns.stream().mapToInt(Column::columnIndex).max().orElse(-1);
  }

  /** Returns a comparator over rows implementing this ordering. */
  public Comparator<Row> comparator() {
    return (left, right) -> {
      for (Column column : columns) {
        int cmp =
            compareValues(left.get(column.columnIndex()), right.get(column.columnIndex()));
        if (cmp != 0) {
          return column.direction() == Direction.ASC ? cmp : -cmp;
        }
      }
      return 0;
    };
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compareValues(Object left, Object right) {
    if (left == right) {
      return 0;
    }
    if (left == null) {
      return -1;
    }
    if (right == null) {
      return 1;
    }
    if (left instanceof byte[] && right instanceof byte[]) {
      return UnsignedBytes.lexicographicalComparator().compare((byte[]) left, (byte[]) right);
    }
    return ((Comparable) left).compareTo(right);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Ordering && columns.equals(((Ordering) o).columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    return "Ordering" + columns;
  }
}
