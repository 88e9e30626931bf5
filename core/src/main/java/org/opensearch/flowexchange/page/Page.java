/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.page;

import java.util.List;
import org.opensearch.flowexchange.data.Row;

/**
 * A batch of rows sharing one column count. Pages are the unit a producer hands to the framing
 * layer and the unit a consumer gets back after decoding one data message.
 */
public interface Page {

  /** Returns the number of rows in this page. */
  int getPositionCount();

  /** Returns the number of columns in this page. */
  int getChannelCount();

  /**
   * Returns the row at the given position.
   *
   * @param position the row index (0-based)
   * @return the row
   */
  Row getRow(int position);

  /** Returns the rows of this page in order. */
  List<Row> getRows();

  /**
   * Returns the value at the given row and column position.
   *
   * @param position the row index (0-based)
   * @param channel the column index (0-based)
   * @return the value, or null if the cell is null
   */
  default Object getValue(int position, int channel) {
    if (channel < 0 || channel >= getChannelCount()) {
      throw new IndexOutOfBoundsException(
          "Channel " + channel + " out of range [0, " + getChannelCount() + ")");
    }
    return getRow(position).get(channel);
  }

  /**
   * Returns a sub-region of this page.
   *
   * @param positionOffset the starting row index
   * @param length the number of rows in the region
   * @return a new Page representing the sub-region
   */
  Page getRegion(int positionOffset, int length);

  /** Returns true if every row of this page has zero columns. */
  default boolean isZeroWidth() {
    return getChannelCount() == 0;
  }

  /** Returns an empty page with zero rows and the given number of columns. */
  static Page empty(int channelCount) {
    return new RowPage(List.of(), channelCount);
  }
}
