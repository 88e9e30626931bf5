/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.util.ArrayList;
import java.util.List;
import org.opensearch.flowexchange.codec.DatumCodec;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.flow.FlowId;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.page.RowPage;

/**
 * Producer side of the stream protocol. Collects rows and metadata and turns them into messages:
 * the header goes on the first message, the typing on the first message with encoded rows, and
 * batches of zero-column rows are sent as a count.
 *
 * <p>Metadata follows the rows of its message, so once metadata is pending the batch must be
 * flushed before more rows are added.
 */
public class StreamEncoder {

  private final ProducerHeader header;
  private final List<DatumInfo> typing;
  private final DatumCodec codec;
  private final List<Row> rows = new ArrayList<>();
  private final List<ProducerMetadata> metadata = new ArrayList<>();
  private boolean headerSent;
  private boolean typingSent;

  public StreamEncoder(FlowId flowId, int streamId, List<DatumInfo> typing, DatumCodec codec) {
    this.header = new ProducerHeader(flowId, streamId);
    this.typing = List.copyOf(typing);
    this.codec = codec;
  }

  public void addRow(Row row) {
    if (!metadata.isEmpty()) {
      throw new IllegalStateException("Flush pending metadata before adding rows");
    }
    if (row.size() != typing.size()) {
      throw new IllegalArgumentException(
          "Row " + row + " does not match typing of " + typing.size() + " columns");
    }
    rows.add(row);
  }

  public void addMetadata(ProducerMetadata entry) {
    metadata.add(entry);
  }

  public int getPendingRowCount() {
    return rows.size();
  }

  /** Returns true if nothing is pending and the header has been sent. */
  public boolean isEmpty() {
    return rows.isEmpty() && metadata.isEmpty() && headerSent;
  }

  /** Discards the pending rows, keeping pending metadata. Used when the stream fails. */
  public void discardRows() {
    rows.clear();
  }

  /** Builds the next message from everything pending and resets the batch. */
  public ProducerMessage flush() {
    ProducerHeader messageHeader = headerSent ? null : header;
    headerSent = true;
    List<DatumInfo> messageTyping = null;
    ProducerData data;
    if (rows.isEmpty()) {
      data = ProducerData.ofMetadata(metadata);
    } else if (typing.isEmpty()) {
      data = new ProducerData(new byte[0], rows.size(), metadata);
    } else {
      if (!typingSent) {
        messageTyping = typing;
        typingSent = true;
      }
      byte[] encoded = codec.encodeRows(new RowPage(rows, typing.size()), typing);
      data = new ProducerData(encoded, 0, metadata);
    }
    rows.clear();
    metadata.clear();
    return new ProducerMessage(messageHeader, messageTyping, data);
  }
}
