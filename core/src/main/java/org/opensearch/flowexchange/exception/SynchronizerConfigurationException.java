/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/** An input synchronizer specification is invalid or its sources disagree on the schema. */
public class SynchronizerConfigurationException extends FlowExchangeException {

  public SynchronizerConfigurationException(String message) {
    super(message);
  }
}
