/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.DatumEncoding;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.page.Page;
import org.opensearch.flowexchange.page.RowPage;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StreamDatumCodecTest {

  private static final List<DatumInfo> ALL_TYPES =
      DatumInfo.valueTyping(
          List.of(
              ColumnType.BOOLEAN,
              ColumnType.INT,
              ColumnType.LONG,
              ColumnType.FLOAT,
              ColumnType.DOUBLE,
              ColumnType.STRING,
              ColumnType.BYTES,
              ColumnType.TIMESTAMP,
              ColumnType.DATE));

  private final StreamDatumCodec codec = new StreamDatumCodec();

  @Test
  void should_decode_every_column_type() {
    Row full =
        Row.of(
            true,
            Integer.MIN_VALUE,
            Long.MAX_VALUE,
            1.5f,
            -2.25,
            "héllo",
            new byte[] {0, -1, 7},
            1_700_000_000_000_000L,
            19_700);
    Row nulls = Row.of(null, null, null, null, null, null, null, null, null);

    Page decoded = decode(List.of(full, nulls), ALL_TYPES);

    assertEquals(List.of(full, nulls), decoded.getRows());
  }

  @Test
  void should_keep_nan_payloads_and_signed_zero() {
    List<DatumInfo> typing = DatumInfo.valueTyping(List.of(ColumnType.DOUBLE, ColumnType.FLOAT));
    double nan = Double.longBitsToDouble(0x7ff8000000000abcL);
    float negativeZero = -0.0f;

    Row decoded = decode(List.of(Row.of(nan, negativeZero)), typing).getRow(0);

    assertEquals(0x7ff8000000000abcL, Double.doubleToRawLongBits((Double) decoded.get(0)));
    assertEquals(
        Float.floatToRawIntBits(negativeZero), Float.floatToRawIntBits((Float) decoded.get(1)));
  }

  @Test
  void should_tell_empty_values_from_nulls() {
    List<DatumInfo> typing = DatumInfo.valueTyping(List.of(ColumnType.STRING, ColumnType.BYTES));

    Page decoded = decode(List.of(Row.of("", new byte[0]), Row.of(null, null)), typing);

    assertEquals("", decoded.getValue(0, 0));
    assertArrayEquals(new byte[0], (byte[]) decoded.getValue(0, 1));
    assertEquals(Arrays.asList(null, null), Arrays.asList(decoded.getRow(1).toArray()));
  }

  @Test
  void should_decode_key_encoded_columns() {
    List<DatumInfo> typing =
        List.of(
            new DatumInfo(DatumEncoding.ASCENDING_KEY, ColumnType.STRING),
            new DatumInfo(DatumEncoding.DESCENDING_KEY, ColumnType.LONG),
            DatumInfo.value(ColumnType.INT));
    List<Row> rows = List.of(Row.of("a\u0000b", -3L, 9), Row.of(null, null, null));

    assertEquals(rows, decode(rows, typing).getRows());
  }

  @Test
  void should_encode_an_empty_page() {
    assertEquals(0, decode(List.of(), ALL_TYPES).getPositionCount());
  }

  @Test
  void should_reject_value_of_wrong_type() {
    List<DatumInfo> typing = DatumInfo.valueTyping(List.of(ColumnType.LONG));

    assertThrows(
        IllegalArgumentException.class,
        () -> codec.encodeRows(new RowPage(List.of(Row.of(1)), 1), typing));
  }

  @Test
  void should_reject_string_with_unpaired_surrogate() {
    RowPage page = new RowPage(List.of(Row.of("a\uD800b")), 1);

    for (DatumEncoding encoding :
        List.of(DatumEncoding.VALUE, DatumEncoding.ASCENDING_KEY, DatumEncoding.DESCENDING_KEY)) {
      List<DatumInfo> typing = List.of(new DatumInfo(encoding, ColumnType.STRING));
      assertThrows(IllegalArgumentException.class, () -> codec.encodeRows(page, typing));
    }
  }

  @Test
  void should_reject_trailing_bytes() {
    List<DatumInfo> typing = DatumInfo.valueTyping(List.of(ColumnType.INT));
    byte[] encoded = codec.encodeRows(new RowPage(List.of(Row.of(1)), 1), typing);
    byte[] padded = Arrays.copyOf(encoded, encoded.length + 1);

    assertThrows(IllegalArgumentException.class, () -> codec.decodeRows(padded, typing));
  }

  private Page decode(List<Row> rows, List<DatumInfo> typing) {
    byte[] encoded = codec.encodeRows(new RowPage(rows, typing.size()), typing);
    return codec.decodeRows(encoded, typing);
  }
}
