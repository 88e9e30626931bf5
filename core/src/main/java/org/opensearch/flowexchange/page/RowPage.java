/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.page;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.opensearch.flowexchange.data.Row;

/** Row-based {@link Page} implementation backed by a list of {@link Row}s of equal width. */
public class RowPage implements Page {

  private final List<Row> rows;
  private final int channelCount;

  /**
   * Creates a RowPage from pre-built rows.
   *
   * @param rows the rows, each with exactly {@code channelCount} columns
   * @param channelCount the number of columns
   */
  public RowPage(List<Row> rows, int channelCount) {
    if (channelCount < 0) {
      throw new IllegalArgumentException("channelCount must be non-negative: " + channelCount);
    }
    for (Row row : rows) {
      if (row.size() != channelCount) {
        throw new IllegalArgumentException(
            "Row " + row + " has " + row.size() + " columns, expected " + channelCount);
      }
    }
    this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    this.channelCount = channelCount;
  }

  /** Creates a page of {@code count} zero-column rows. */
  public static RowPage ofEmptyRows(int count) {
    return new RowPage(Collections.nCopies(count, Row.empty()), 0);
  }

  @Override
  public int getPositionCount() {
    return rows.size();
  }

  @Override
  public int getChannelCount() {
    return channelCount;
  }

  @Override
  public Row getRow(int position) {
    if (position < 0 || position >= rows.size()) {
      throw new IndexOutOfBoundsException(
          "Position " + position + " out of range [0, " + rows.size() + ")");
    }
    return rows.get(position);
  }

  @Override
  public List<Row> getRows() {
    return rows;
  }

  @Override
  public Page getRegion(int positionOffset, int length) {
    if (positionOffset < 0 || length < 0 || positionOffset + length > rows.size()) {
      throw new IndexOutOfBoundsException(
          "Region ["
              + positionOffset
              + ", "
              + (positionOffset + length)
              + ") out of range [0, "
              + rows.size()
              + ")");
    }
    return new RowPage(rows.subList(positionOffset, positionOffset + length), channelCount);
  }

  @Override
  public String toString() {
    return "RowPage{rows=" + rows.size() + ", channels=" + channelCount + '}';
  }
}
