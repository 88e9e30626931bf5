/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/** A row could not be routed, e.g. a range router key matched no span and no default is set. */
public class RoutingException extends FlowExchangeException {

  public RoutingException(String message) {
    super(message);
  }
}
