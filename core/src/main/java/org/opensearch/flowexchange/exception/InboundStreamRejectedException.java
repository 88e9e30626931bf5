/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/**
 * An inbound connection names a stream this node cannot attach it to: the flow or stream is not
 * registered here, or another producer is already attached.
 */
public class InboundStreamRejectedException extends FlowExchangeException {

  public InboundStreamRejectedException(String message) {
    super(message);
  }
}
