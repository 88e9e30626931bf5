/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/** An output router specification is invalid. Raised at setup, before any row flows. */
public class RouterConfigurationException extends FlowExchangeException {

  public RouterConfigurationException(String message) {
    super(message);
  }
}
