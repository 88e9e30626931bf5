/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

import org.opensearch.flowexchange.metadata.RemoteError;

/** A terminal error received from a producer, rethrown on the consumer side. */
public class RemoteProducerException extends FlowExchangeException {

  private final RemoteError remoteError;

  public RemoteProducerException(RemoteError remoteError) {
    super(remoteError.message());
    this.remoteError = remoteError;
  }

  public RemoteError getRemoteError() {
    return remoteError;
  }

  @Override
  public String getSqlState() {
    return remoteError.accept(
        new RemoteError.Visitor<String>() {
          @Override
          public String visitSqlError(RemoteError.SqlError error) {
            return error.code();
          }

          @Override
          public String visitRetryableTxnError(RemoteError.RetryableTxnError error) {
            return "40001";
          }
        });
  }
}
