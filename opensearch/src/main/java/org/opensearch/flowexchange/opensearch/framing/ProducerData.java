/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.Data;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.flowexchange.metadata.ProducerMetadata;

/**
 * The payload of a message: a batch of rows and the metadata that follows them. Rows are either
 * one encoded buffer or, on streams without columns, just their count.
 */
@Data
public class ProducerData implements Writeable {

  private static final byte[] NO_BYTES = new byte[0];

  /** Rows encoded with the stream's typing; empty if the message carries no encoded rows. */
  private final byte[] rawBytes;

  /** Number of zero-column rows, sent instead of an encoded buffer. */
  private final int numEmptyRows;

  /** Metadata, in the order sent; it follows the rows of this message. */
  private final List<ProducerMetadata> metadata;

  public ProducerData(byte[] rawBytes, int numEmptyRows, List<ProducerMetadata> metadata) {
    if (numEmptyRows < 0) {
      throw new IllegalArgumentException("numEmptyRows must not be negative: " + numEmptyRows);
    }
    this.rawBytes = Objects.requireNonNull(rawBytes, "rawBytes");
    this.numEmptyRows = numEmptyRows;
    this.metadata = List.copyOf(metadata);
  }

  public static ProducerData empty() {
    return new ProducerData(NO_BYTES, 0, List.of());
  }

  public static ProducerData ofMetadata(List<ProducerMetadata> metadata) {
    return new ProducerData(NO_BYTES, 0, metadata);
  }

  /** Constructor for deserialization from stream. */
  public ProducerData(StreamInput in) throws IOException {
    this.rawBytes = in.readByteArray();
    this.numEmptyRows = in.readVInt();
    int count = in.readVInt();
    List<ProducerMetadata> read = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      read.add(RemoteProducerMetadata.read(in));
    }
    this.metadata = List.copyOf(read);
  }

  @Override
  public void writeTo(StreamOutput out) throws IOException {
    out.writeByteArray(rawBytes);
    out.writeVInt(numEmptyRows);
    out.writeVInt(metadata.size());
    for (ProducerMetadata entry : metadata) {
      RemoteProducerMetadata.write(out, entry);
    }
  }

  public boolean hasEncodedRows() {
    return rawBytes.length > 0;
  }
}
