/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.transport;

/** Receiving end of an inbound connection, called by the transport in frame order. */
public interface FrameHandler {

  /** Handles the next frame. */
  void onFrame(byte[] frame);

  /** The producer closed the connection normally. */
  void onClose();

  /** The connection broke. */
  void onFailure(Exception cause);
}
