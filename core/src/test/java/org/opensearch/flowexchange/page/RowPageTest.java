/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.page;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.flowexchange.data.Row;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowPageTest {

  @Test
  void should_create_page_with_rows_and_columns() {
    RowPage page = new RowPage(List.of(Row.of("Alice", 30), Row.of("Bob", null)), 2);

    assertEquals(2, page.getPositionCount());
    assertEquals(2, page.getChannelCount());
    assertEquals("Alice", page.getValue(0, 0));
    assertEquals(30, page.getValue(0, 1));
    assertNull(page.getValue(1, 1));
  }

  @Test
  void should_create_sub_region() {
    RowPage page = new RowPage(List.of(Row.of(1), Row.of(2), Row.of(3), Row.of(4)), 1);

    Page region = page.getRegion(1, 2);

    assertEquals(2, region.getPositionCount());
    assertEquals(2, region.getValue(0, 0));
    assertEquals(3, region.getValue(1, 0));
  }

  @Test
  void should_throw_on_invalid_position() {
    RowPage page = new RowPage(List.of(Row.of(1)), 1);

    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(1, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getValue(0, 1));
    assertThrows(IndexOutOfBoundsException.class, () -> page.getRegion(0, 2));
  }

  @Test
  void should_reject_rows_of_wrong_width() {
    assertThrows(
        IllegalArgumentException.class, () -> new RowPage(List.of(Row.of(1, 2), Row.of(3)), 2));
  }

  @Test
  void should_represent_zero_column_rows() {
    RowPage page = RowPage.ofEmptyRows(3);

    assertEquals(3, page.getPositionCount());
    assertTrue(page.isZeroWidth());
    assertEquals(Row.empty(), page.getRow(2));
  }

  @Test
  void should_create_empty_page() {
    Page page = Page.empty(4);

    assertEquals(0, page.getPositionCount());
    assertEquals(4, page.getChannelCount());
  }
}
