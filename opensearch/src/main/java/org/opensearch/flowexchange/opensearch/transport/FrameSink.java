/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.transport;

import java.io.Closeable;
import java.io.IOException;

/** Sending end of an ordered, reliable connection carrying the frames of one stream. */
public interface FrameSink extends Closeable {

  /**
   * Sends one frame. Frames arrive in the order they were sent.
   *
   * @throws IOException if the connection failed; no further frame can be sent
   */
  void send(byte[] frame) throws IOException;
}
