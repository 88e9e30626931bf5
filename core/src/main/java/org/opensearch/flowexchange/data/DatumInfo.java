/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.data;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Typing of one column on the wire: its encoding and its type. Both are always present. */
public record DatumInfo(DatumEncoding encoding, ColumnType type) {

  public DatumInfo {
    Objects.requireNonNull(encoding, "encoding");
    Objects.requireNonNull(type, "type");
  }

  public static DatumInfo value(ColumnType type) {
    return new DatumInfo(DatumEncoding.VALUE, type);
  }

  /** Builds a value-encoded typing descriptor for the given column types. */
  public static List<DatumInfo> valueTyping(List<ColumnType> types) {
    return types.stream().map(DatumInfo::value).collect(Collectors.toUnmodifiableList());
  }

  /** Returns the column types of a typing descriptor. */
  public static List<ColumnType> types(List<DatumInfo> typing) {
    return typing.stream().map(DatumInfo::type).collect(Collectors.toUnmodifiableList());
  }
}
