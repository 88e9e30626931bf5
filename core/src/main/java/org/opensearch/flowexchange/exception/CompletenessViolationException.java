/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/** A sender's row-count records disagree with what the receiver actually observed. */
public class CompletenessViolationException extends FlowExchangeException {

  private final String senderId;

  public CompletenessViolationException(String senderId, String message) {
    super(message);
    this.senderId = senderId;
  }

  public String getSenderId() {
    return senderId;
  }
}
