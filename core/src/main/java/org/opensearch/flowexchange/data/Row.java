/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.data;

import java.util.Arrays;
import java.util.List;

/**
 * An immutable positional tuple of column values. A row may have zero columns; such rows travel on
 * the wire as a bare count.
 *
 * <p>Equality compares values deeply, so {@code byte[]} columns compare by content.
 */
public final class Row {

  private static final Row EMPTY = new Row(new Object[0]);

  private final Object[] values;

  private Row(Object[] values) {
    this.values = values;
  }

  /** Creates a row holding a copy of the given values. */
  public static Row of(Object... values) {
    if (values.length == 0) {
      return EMPTY;
    }
    return new Row(values.clone());
  }

  public static Row of(List<?> values) {
    return of(values.toArray());
  }

  /** Returns the shared zero-column row. */
  public static Row empty() {
    return EMPTY;
  }

  /** Returns the number of columns. */
  public int size() {
    return values.length;
  }

  /**
   * Returns the value at the given column.
   *
   * @param column the column index (0-based)
   * @return the value, or null
   */
  public Object get(int column) {
    if (column < 0 || column >= values.length) {
      throw new IndexOutOfBoundsException(
          "Column " + column + " out of range [0, " + values.length + ")");
    }
    return values[column];
  }

  /** Returns a defensive copy of the values. */
  public Object[] toArray() {
    return values.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Row)) {
      return false;
    }
    return Arrays.deepEquals(values, ((Row) o).values);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.deepToString(values);
  }
}
