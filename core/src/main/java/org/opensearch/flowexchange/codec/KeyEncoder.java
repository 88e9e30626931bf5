/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.codec;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import com.google.common.primitives.UnsignedBytes;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.DatumEncoding;

/**
 * Order-preserving key encoding of single datums. Comparing two ascending encodings byte-wise as
 * unsigned bytes gives the same result as comparing the values; descending encodings are the
 * ascending ones with every byte inverted. Encodings are self-delimiting, so keys of several
 * columns can be concatenated and still compare column by column.
 *
 * <p>Layout of the ascending form: a marker byte ({@code 0x00} for null, {@code 0x01} otherwise)
 * followed by the payload. Fixed-width numbers are big-endian with the sign bit flipped; floating
 * point numbers additionally invert all bits of negative values, and every NaN is encoded as the
 * canonical NaN. Strings are UTF-8; strings and byte arrays escape {@code 0x00} as {@code 0x00
 * 0xFF} and end with {@code 0x00 0x01}.
 */
public final class KeyEncoder {

  private static final byte NULL_MARKER = 0x00;
  private static final byte VALUE_MARKER = 0x01;
  private static final byte ESCAPE = 0x00;
  private static final byte ESCAPED_ZERO = (byte) 0xFF;
  private static final byte TERMINATOR = 0x01;

  private KeyEncoder() {}

  /** Unsigned lexicographic comparison of encoded keys. */
  public static Comparator<byte[]> keyComparator() {
    return UnsignedBytes.lexicographicalComparator();
  }

  /** Encodes one datum as a standalone key. */
  public static byte[] encode(Object value, ColumnType type, DatumEncoding encoding) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    encode(out, value, type, encoding);
    return out.toByteArray();
  }

  /**
   * Appends the key encoding of one datum.
   *
   * @throws IllegalArgumentException if the encoding is not a key encoding or the value does not
   *     match the type
   */
  public static void encode(
      ByteArrayDataOutput out, Object value, ColumnType type, DatumEncoding encoding) {
    if (!encoding.isKeyEncoding()) {
      throw new IllegalArgumentException(encoding + " is not a key encoding");
    }
    type.check(value);
    if (encoding == DatumEncoding.ASCENDING_KEY) {
      encodeAscending(out, value, type);
      return;
    }
    ByteArrayDataOutput ascending = ByteStreams.newDataOutput();
    encodeAscending(ascending, value, type);
    byte[] bytes = ascending.toByteArray();
    for (int i = 0; i < bytes.length; i++) {
      bytes[i] = (byte) ~bytes[i];
    }
    out.write(bytes);
  }

  /**
   * Reads one key-encoded datum from the buffer, advancing its position past it.
   *
   * @throws IllegalArgumentException if the bytes are not a valid encoding
   */
  public static Object decode(ByteBuffer in, ColumnType type, DatumEncoding encoding) {
    if (!encoding.isKeyEncoding()) {
      throw new IllegalArgumentException(encoding + " is not a key encoding");
    }
    KeyReader reader = new KeyReader(in, encoding == DatumEncoding.DESCENDING_KEY);
    try {
      byte marker = reader.next();
      if (marker == NULL_MARKER) {
        return null;
      }
      if (marker != VALUE_MARKER) {
        throw new IllegalArgumentException("Invalid key marker byte: " + marker);
      }
      return decodePayload(reader, type);
    } catch (BufferUnderflowException e) {
      throw new IllegalArgumentException("Truncated " + type + " key", e);
    }
  }

  private static void encodeAscending(ByteArrayDataOutput out, Object value, ColumnType type) {
    if (value == null) {
      out.writeByte(NULL_MARKER);
      return;
    }
    out.writeByte(VALUE_MARKER);
    switch (type) {
      case BOOLEAN:
        out.writeByte((Boolean) value ? 1 : 0);
        break;
      case INT:
      case DATE:
        out.writeInt((Integer) value ^ Integer.MIN_VALUE);
        break;
      case LONG:
      case TIMESTAMP:
        out.writeLong((Long) value ^ Long.MIN_VALUE);
        break;
      case FLOAT:
        // Collapses NaN payloads to the canonical NaN.
        int intBits = Float.floatToIntBits((Float) value);
        out.writeInt(intBits < 0 ? ~intBits : intBits ^ Integer.MIN_VALUE);
        break;
      case DOUBLE:
        long longBits = Double.doubleToLongBits((Double) value);
        out.writeLong(longBits < 0 ? ~longBits : longBits ^ Long.MIN_VALUE);
        break;
      case STRING:
        writeEscaped(out, ((String) value).getBytes(StandardCharsets.UTF_8));
        break;
      case BYTES:
        writeEscaped(out, (byte[]) value);
        break;
      default:
        throw new IllegalArgumentException("Unsupported key type: " + type);
    }
  }

  private static void writeEscaped(ByteArrayDataOutput out, byte[] bytes) {
    for (byte b : bytes) {
      if (b == 0) {
        out.writeByte(ESCAPE);
        out.writeByte(ESCAPED_ZERO);
      } else {
        out.writeByte(b);
      }
    }
    out.writeByte(ESCAPE);
    out.writeByte(TERMINATOR);
  }

  private static Object decodePayload(KeyReader reader, ColumnType type) {
    switch (type) {
      case BOOLEAN:
        return reader.next() != 0;
      case INT:
      case DATE:
        return reader.nextInt() ^ Integer.MIN_VALUE;
      case LONG:
      case TIMESTAMP:
        return reader.nextLong() ^ Long.MIN_VALUE;
      case FLOAT:
        int intBits = reader.nextInt();
        return Float.intBitsToFloat(intBits < 0 ? intBits ^ Integer.MIN_VALUE : ~intBits);
      case DOUBLE:
        long longBits = reader.nextLong();
        return Double.longBitsToDouble(longBits < 0 ? longBits ^ Long.MIN_VALUE : ~longBits);
      case STRING:
        return new String(readEscaped(reader), StandardCharsets.UTF_8);
      case BYTES:
        return readEscaped(reader);
      default:
        throw new IllegalArgumentException("Unsupported key type: " + type);
    }
  }

  private static byte[] readEscaped(KeyReader reader) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    while (true) {
      byte b = reader.next();
      if (b != ESCAPE) {
        out.writeByte(b);
        continue;
      }
      byte next = reader.next();
      if (next == TERMINATOR) {
        return out.toByteArray();
      }
      if (next != ESCAPED_ZERO) {
        throw new IllegalArgumentException("Invalid escape sequence in key: 0x00 " + next);
      }
      out.writeByte(0);
    }
  }

  /** Reads bytes from a buffer, undoing the inversion of descending keys. */
  private static final class KeyReader {
    private final ByteBuffer in;
    private final boolean inverted;

    KeyReader(ByteBuffer in, boolean inverted) {
      this.in = in;
      this.inverted = inverted;
    }

    byte next() {
      byte b = in.get();
      return inverted ? (byte) ~b : b;
    }

    int nextInt() {
      int value = 0;
      for (int i = 0; i < Integer.BYTES; i++) {
        value = (value << 8) | (next() & 0xFF);
      }
      return value;
    }

    long nextLong() {
      long value = 0;
      for (int i = 0; i < Long.BYTES; i++) {
        value = (value << 8) | (next() & 0xFF);
      }
      return value;
    }
  }
}
