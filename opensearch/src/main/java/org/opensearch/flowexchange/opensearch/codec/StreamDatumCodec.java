/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.codec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.List;
import org.opensearch.common.io.stream.BytesStreamOutput;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.flowexchange.codec.DatumCodec;
import org.opensearch.flowexchange.codec.KeyEncoder;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.page.Page;
import org.opensearch.flowexchange.page.PageBuilder;

/**
 * Datum codec over OpenSearch streams. The buffer starts with the row count; each row is its
 * columns in order. VALUE datums are a presence flag followed by the value, key-encoded datums are
 * the length-prefixed {@link KeyEncoder} bytes.
 *
 * <p>Floating point values are written as their raw bits so that NaN payloads and signed zeros
 * survive the round trip.
 */
public class StreamDatumCodec implements DatumCodec {

  @Override
  public byte[] encodeRows(Page page, List<DatumInfo> typing) {
    if (page.getChannelCount() != typing.size()) {
      throw new IllegalArgumentException(
          "Page of " + page.getChannelCount() + " columns does not match typing " + typing);
    }
    try (BytesStreamOutput out = new BytesStreamOutput()) {
      out.writeVInt(page.getPositionCount());
      for (Row row : page.getRows()) {
        for (int i = 0; i < typing.size(); i++) {
          DatumInfo info = typing.get(i);
          if (info.encoding().isKeyEncoding()) {
            out.writeByteArray(KeyEncoder.encode(row.get(i), info.type(), info.encoding()));
          } else {
            writeValue(out, info.type().check(row.get(i)), info.type());
          }
        }
      }
      return BytesReference.toBytes(out.bytes());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode rows", e);
    }
  }

  @Override
  public Page decodeRows(byte[] bytes, List<DatumInfo> typing) {
    try (StreamInput in = StreamInput.wrap(bytes)) {
      int count = in.readVInt();
      PageBuilder builder = new PageBuilder(typing.size());
      for (int r = 0; r < count; r++) {
        builder.beginRow();
        for (int i = 0; i < typing.size(); i++) {
          DatumInfo info = typing.get(i);
          if (info.encoding().isKeyEncoding()) {
            builder.setValue(i, readKey(in.readByteArray(), info));
          } else {
            builder.setValue(i, readValue(in, info.type()));
          }
        }
        builder.endRow();
      }
      if (in.available() > 0) {
        throw new IllegalArgumentException(
            in.available() + " trailing bytes after " + count + " rows");
      }
      return builder.build();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to decode rows", e);
    }
  }

  private static Object readKey(byte[] key, DatumInfo info) {
    ByteBuffer buffer = ByteBuffer.wrap(key);
    Object value = KeyEncoder.decode(buffer, info.type(), info.encoding());
    if (buffer.hasRemaining()) {
      throw new IllegalArgumentException("Key datum of type " + info.type() + " has extra bytes");
    }
    return value;
  }

  private static void writeValue(StreamOutput out, Object value, ColumnType type)
      throws IOException {
    out.writeBoolean(value != null);
    if (value == null) {
      return;
    }
    switch (type) {
      case BOOLEAN:
        out.writeBoolean((Boolean) value);
        break;
      case INT:
      case DATE:
        out.writeZLong((Integer) value);
        break;
      case LONG:
      case TIMESTAMP:
        out.writeZLong((Long) value);
        break;
      case FLOAT:
        out.writeInt(Float.floatToRawIntBits((Float) value));
        break;
      case DOUBLE:
        out.writeLong(Double.doubleToRawLongBits((Double) value));
        break;
      case STRING:
        out.writeString((String) value);
        break;
      case BYTES:
        out.writeByteArray((byte[]) value);
        break;
      default:
        throw new IllegalArgumentException("Unsupported column type: " + type);
    }
  }

  private static Object readValue(StreamInput in, ColumnType type) throws IOException {
    if (!in.readBoolean()) {
      return null;
    }
    switch (type) {
      case BOOLEAN:
        return in.readBoolean();
      case INT:
      case DATE:
        return Math.toIntExact(in.readZLong());
      case LONG:
      case TIMESTAMP:
        return in.readZLong();
      case FLOAT:
        return Float.intBitsToFloat(in.readInt());
      case DOUBLE:
        return Double.longBitsToDouble(in.readLong());
      case STRING:
        return in.readString();
      case BYTES:
        return in.readByteArray();
      default:
        throw new IllegalArgumentException("Unsupported column type: " + type);
    }
  }
}
