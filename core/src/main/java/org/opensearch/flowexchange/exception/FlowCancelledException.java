/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/** The flow owning a stream was cancelled while a call on that stream was in progress. */
public class FlowCancelledException extends FlowExchangeException {

  public static final String QUERY_CANCELED = "57014";

  public FlowCancelledException(String message) {
    super(message);
  }

  public FlowCancelledException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public String getSqlState() {
    return QUERY_CANCELED;
  }
}
