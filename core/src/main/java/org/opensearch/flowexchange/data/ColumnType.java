/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.data;

import com.google.common.base.Utf8;

/**
 * Column types a stream can carry. Each type is bound to the Java class of its values; {@code null}
 * is a legal value of every type.
 *
 * <p>TIMESTAMP values are epoch milliseconds ({@link Long}) and DATE values are epoch days ({@link
 * Integer}).
 */
public enum ColumnType {
  BOOLEAN(Boolean.class),
  INT(Integer.class),
  LONG(Long.class),
  FLOAT(Float.class),
  DOUBLE(Double.class),
  STRING(String.class),
  BYTES(byte[].class),
  TIMESTAMP(Long.class),
  DATE(Integer.class);

  private final Class<?> valueClass;

  ColumnType(Class<?> valueClass) {
    this.valueClass = valueClass;
  }

  /**
   * Checks that a value conforms to this type. STRING values must be well-formed UTF-16, so that
   * they map to UTF-8 and back without loss.
   *
   * @throws IllegalArgumentException if the value is of another class, or is a string with an
   *     unpaired surrogate
   */
  public Object check(Object value) {
    if (value == null) {
      return null;
    }
    if (!valueClass.isInstance(value)) {
      throw new IllegalArgumentException(
          "Value of class "
              + value.getClass().getSimpleName()
              + " is not a valid "
              + name()
              + " datum");
    }
    if (this == STRING) {
      try {
        Utf8.encodedLength((String) value);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(
            "STRING datum is not valid UTF-16: " + e.getMessage(), e);
      }
    }
    return value;
  }
}
