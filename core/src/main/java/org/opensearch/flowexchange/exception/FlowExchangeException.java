/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/**
 * Base class of the failures raised by routers, synchronizers, the framing layer and the
 * compatibility gate. Every failure carries the SQL state it is reported under when it is shipped
 * to another node as terminal error metadata.
 */
public class FlowExchangeException extends RuntimeException {

  /** SQL state for internal errors. */
  public static final String INTERNAL_ERROR = "XX000";

  public FlowExchangeException(String message) {
    super(message);
  }

  public FlowExchangeException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns the SQL state reported for this failure. */
  public String getSqlState() {
    return INTERNAL_ERROR;
  }
}
