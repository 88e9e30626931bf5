/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.exchange;

import lombok.extern.log4j.Log4j2;
import org.opensearch.flowexchange.codec.DatumCodec;
import org.opensearch.flowexchange.exception.InboundStreamRejectedException;
import org.opensearch.flowexchange.exception.ProtocolViolationException;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.flow.FlowId;
import org.opensearch.flowexchange.flow.FlowRegistry;
import org.opensearch.flowexchange.opensearch.framing.ProducerHeader;
import org.opensearch.flowexchange.opensearch.framing.ProducerMessage;
import org.opensearch.flowexchange.opensearch.framing.StreamDecoder;
import org.opensearch.flowexchange.opensearch.transport.FrameHandler;

/**
 * Attaches inbound connections to their streams. The header of the first frame names the {@code
 * (flowId, streamId)} slot; the slot must have been registered by the consumer and must not have a
 * producer yet.
 */
@Log4j2
public class InboundStreamDispatcher {

  private final FlowRegistry registry;
  private final DatumCodec codec;

  public InboundStreamDispatcher(FlowRegistry registry, DatumCodec codec) {
    this.registry = registry;
    this.codec = codec;
  }

  /**
   * Handles the first frame of a new inbound connection.
   *
   * @return the handler of the connection's remaining frames
   * @throws ProtocolViolationException if the frame is malformed or has no header
   * @throws InboundStreamRejectedException if the slot is unknown or already taken
   */
  public FrameHandler accept(byte[] firstFrame) {
    ProducerMessage message = StreamDecoder.parse(firstFrame);
    ProducerHeader header = message.getHeader();
    if (header == null) {
      throw new ProtocolViolationException("First message of the stream has no header");
    }
    FlowId flowId = header.getFlowId();
    int streamId = header.getStreamId();
    StreamBuffer buffer =
        registry
            .lookupStream(flowId, streamId)
            .orElseThrow(
                () ->
                    new InboundStreamRejectedException(
                        "No stream " + flowId + "/" + streamId + " registered on this node"));
    if (!buffer.markProducerConnected()) {
      throw new InboundStreamRejectedException(
          "Stream " + flowId + "/" + streamId + " already has a producer");
    }
    log.debug("Attached inbound stream {}/{}", flowId, streamId);
    Inbox inbox = new Inbox(buffer, codec);
    inbox.onMessage(message);
    return inbox;
  }
}
