/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.opensearch.common.io.stream.BytesStreamOutput;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.DatumEncoding;
import org.opensearch.flowexchange.data.DatumInfo;

/**
 * One frame of a stream. The header is present on the first frame only; the typing on the frame
 * that establishes it, at or before the first encoded rows.
 */
@Data
public class ProducerMessage implements Writeable {

  /** Present on the first message of the stream only, otherwise null. */
  private final ProducerHeader header;

  /** Present on the message that establishes the stream's typing, otherwise null. */
  private final List<DatumInfo> typing;

  private final ProducerData data;

  public ProducerMessage(ProducerHeader header, List<DatumInfo> typing, ProducerData data) {
    this.header = header;
    this.typing = typing == null ? null : List.copyOf(typing);
    this.data = data;
  }

  /** Constructor for deserialization from stream. */
  public ProducerMessage(StreamInput in) throws IOException {
    this.header = in.readOptionalWriteable(ProducerHeader::new);
    if (in.readBoolean()) {
      int count = in.readVInt();
      List<DatumInfo> read = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        read.add(new DatumInfo(in.readEnum(DatumEncoding.class), in.readEnum(ColumnType.class)));
      }
      this.typing = List.copyOf(read);
    } else {
      this.typing = null;
    }
    this.data = new ProducerData(in);
  }

  @Override
  public void writeTo(StreamOutput out) throws IOException {
    out.writeOptionalWriteable(header);
    if (typing != null) {
      out.writeBoolean(true);
      out.writeVInt(typing.size());
      for (DatumInfo info : typing) {
        out.writeEnum(info.encoding());
        out.writeEnum(info.type());
      }
    } else {
      out.writeBoolean(false);
    }
    data.writeTo(out);
  }

  /** Serializes this message into one frame. */
  public byte[] toBytes() throws IOException {
    try (BytesStreamOutput out = new BytesStreamOutput()) {
      writeTo(out);
      return BytesReference.toBytes(out.bytes());
    }
  }

  /**
   * Parses one frame.
   *
   * @throws IOException if the frame is truncated or has trailing bytes
   */
  public static ProducerMessage fromBytes(byte[] frame) throws IOException {
    try (StreamInput in = StreamInput.wrap(frame)) {
      ProducerMessage message = new ProducerMessage(in);
      if (in.available() > 0) {
        throw new IOException(in.available() + " trailing bytes after producer message");
      }
      return message;
    }
  }
}
