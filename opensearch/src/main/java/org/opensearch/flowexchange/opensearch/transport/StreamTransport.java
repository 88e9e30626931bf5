/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.transport;

import java.io.IOException;
import org.opensearch.flowexchange.flow.FlowId;

/**
 * Opens connections to other nodes. On the receiving node the transport hands the frames of each
 * inbound connection to {@link
 * org.opensearch.flowexchange.opensearch.exchange.InboundStreamDispatcher}.
 */
public interface StreamTransport {

  /**
   * Opens a connection for one stream.
   *
   * @param flowId the flow the stream belongs to
   * @param streamId the stream
   * @param targetNodeId the node running the consumer
   * @throws IOException if the node cannot be reached
   */
  FrameSink open(FlowId flowId, int streamId, int targetNodeId) throws IOException;
}
