/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.exchange;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.flow.FlowId;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.opensearch.framing.ProducerMessage;
import org.opensearch.flowexchange.opensearch.framing.StreamEncoder;
import org.opensearch.flowexchange.opensearch.transport.FrameSink;
import org.opensearch.flowexchange.opensearch.transport.StreamTransport;

/**
 * Sending endpoint of a remote stream. Drains the stream's buffer on its own task and ships its
 * contents as frames: rows are batched up to the batch size, and a partial batch is flushed once
 * the flush interval passes without new input. Metadata is sent right away, after the rows that
 * preceded it.
 *
 * <p>The first frame carries only the header so the consumer can attach the stream before any row
 * is produced. If the outbox fails, the failure is sent as terminal error metadata, unless an error
 * was already sent, and the buffer is closed so the router drops further rows for this destination.
 */
@Log4j2
public class Outbox implements Runnable {

  /** How an outbox batches and reports its rows. */
  public record Config(
      int batchSize, long flushIntervalMillis, boolean rowCountTracking, String senderId) {}

  private final FlowId flowId;
  private final int streamId;
  private final int targetNodeId;
  private final RowSource source;
  private final StreamEncoder encoder;
  private final StreamTransport transport;
  private final Config config;
  private int rowNumRecords;
  private boolean errorSent;

  public Outbox(
      FlowId flowId,
      int streamId,
      int targetNodeId,
      RowSource source,
      StreamEncoder encoder,
      StreamTransport transport,
      Config config) {
    this.flowId = flowId;
    this.streamId = streamId;
    this.targetNodeId = targetNodeId;
    this.source = source;
    this.encoder = encoder;
    this.transport = transport;
    this.config = config;
  }

  @Override
  public void run() {
    FrameSink sink = null;
    try {
      sink = transport.open(flowId, streamId, targetNodeId);
      log.debug("Opened stream {}/{} to node {}", flowId, streamId, targetNodeId);
      send(sink, encoder.flush());
      drain(sink);
    } catch (IOException | RuntimeException e) {
      log.error("Stream {}/{} to node {} failed", flowId, streamId, targetNodeId, e);
      source.consumerClosed();
      if (sink != null && !errorSent) {
        sendError(sink, e);
      }
    } finally {
      if (sink != null) {
        try {
          sink.close();
        } catch (IOException e) {
          log.warn("Failed to close stream {}/{} to node {}", flowId, streamId, targetNodeId, e);
        }
      }
    }
  }

  private void drain(FrameSink sink) throws IOException {
    while (true) {
      StreamElement element =
          encoder.getPendingRowCount() == 0
              ? source.next()
              : source.poll(config.flushIntervalMillis(), TimeUnit.MILLISECONDS);
      if (element == null) {
        flushRows(sink);
        continue;
      }
      switch (element.getKind()) {
        case ROW:
          encoder.addRow(element.getRow());
          if (encoder.getPendingRowCount() >= config.batchSize()) {
            flushRows(sink);
          }
          break;
        case METADATA:
          addRowNum(false);
          encoder.addMetadata(element.getMetadata());
          send(sink, encoder.flush());
          errorSent |= element.getMetadata().kind() == ProducerMetadata.Kind.ERROR;
          break;
        default:
          flushRows(sink);
          if (config.rowCountTracking()) {
            addRowNum(true);
            send(sink, encoder.flush());
          }
          log.debug("Finished stream {}/{} to node {}", flowId, streamId, targetNodeId);
          return;
      }
    }
  }

  private void flushRows(FrameSink sink) throws IOException {
    if (encoder.getPendingRowCount() > 0) {
      addRowNum(false);
      send(sink, encoder.flush());
    }
  }

  /** Appends a row-count record to a message that carries rows, or to the final message. */
  private void addRowNum(boolean lastMsg) {
    if (config.rowCountTracking() && (lastMsg || encoder.getPendingRowCount() > 0)) {
      encoder.addMetadata(new ProducerMetadata.RowNum(config.senderId(), ++rowNumRecords, lastMsg));
    }
  }

  private void sendError(FrameSink sink, Exception cause) {
    encoder.discardRows();
    encoder.addMetadata(ProducerMetadata.error(cause));
    try {
      send(sink, encoder.flush());
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Could not report failure of stream {}/{} to node {}", flowId, streamId, targetNodeId, e);
    }
  }

  private static void send(FrameSink sink, ProducerMessage message) throws IOException {
    sink.send(message.toBytes());
  }
}
