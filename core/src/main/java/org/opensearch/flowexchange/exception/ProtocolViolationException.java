/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/**
 * A producer broke the stream protocol: missing or duplicated header, typing sent twice or
 * changed, data before typing, or a second terminal error. Fatal to the stream, never retried.
 */
public class ProtocolViolationException extends FlowExchangeException {

  public ProtocolViolationException(String message) {
    super(message);
  }

  public ProtocolViolationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getSqlState() {
    return "08P01";
  }
}
