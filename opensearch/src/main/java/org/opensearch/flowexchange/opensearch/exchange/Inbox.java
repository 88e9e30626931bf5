/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.exchange;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opensearch.flowexchange.codec.DatumCodec;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.exception.ProtocolViolationException;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.opensearch.framing.DecodedMessage;
import org.opensearch.flowexchange.opensearch.framing.ProducerMessage;
import org.opensearch.flowexchange.opensearch.framing.StreamDecoder;
import org.opensearch.flowexchange.opensearch.transport.FrameHandler;

/**
 * Receiving endpoint of a remote stream. Decodes the frames of one inbound connection into the
 * buffer the synchronizer reads. Enqueueing rows blocks while the buffer is full, which holds back
 * the connection and so the producer.
 *
 * <p>A protocol violation ends the stream: it is thrown to the transport and also left in the
 * buffer as terminal error metadata, so the consumer learns about it in order.
 */
@Log4j2
public class Inbox implements FrameHandler {

  private final StreamBuffer target;
  private final StreamDecoder decoder;
  private boolean typingChecked;
  private boolean done;

  public Inbox(StreamBuffer target, DatumCodec codec) {
    this.target = target;
    this.decoder = new StreamDecoder(codec);
  }

  @Override
  public void onFrame(byte[] frame) {
    if (done) {
      log.debug("Ignoring frame for finished stream {}", target.getName());
      return;
    }
    ProducerMessage message;
    try {
      message = StreamDecoder.parse(frame);
    } catch (ProtocolViolationException e) {
      throw violation(e);
    }
    onMessage(message);
  }

  /** Validates and delivers one parsed message. */
  void onMessage(ProducerMessage message) {
    DecodedMessage decoded;
    try {
      decoded = decoder.decode(message);
      checkTyping();
    } catch (ProtocolViolationException e) {
      throw violation(e);
    }
    try {
      for (Row row : decoded.page().getRows()) {
        target.enqueue(row);
      }
      for (ProducerMetadata metadata : decoded.metadata()) {
        target.enqueueMetadata(metadata);
      }
    } catch (FlowCancelledException e) {
      done = true;
      throw e;
    }
  }

  private void checkTyping() {
    List<DatumInfo> typing = decoder.getTyping();
    if (typingChecked || typing == null) {
      return;
    }
    typingChecked = true;
    if (!DatumInfo.types(typing).equals(target.getColumnTypes())) {
      throw new ProtocolViolationException(
          String.format(
              "Typing %s on stream %s does not match its columns %s",
              typing, target.getName(), target.getColumnTypes()));
    }
  }

  @Override
  public void onClose() {
    if (!done) {
      done = true;
      target.setNoMoreElements();
    }
  }

  @Override
  public void onFailure(Exception cause) {
    if (!done) {
      log.warn("Inbound connection of stream {} failed", target.getName(), cause);
      fail(cause);
    }
  }

  private ProtocolViolationException violation(ProtocolViolationException e) {
    log.error("Protocol violation on stream {}", target.getName(), e);
    fail(e);
    return e;
  }

  private void fail(Exception cause) {
    done = true;
    target.enqueueMetadata(ProducerMetadata.error(cause));
    target.setNoMoreElements();
  }
}
