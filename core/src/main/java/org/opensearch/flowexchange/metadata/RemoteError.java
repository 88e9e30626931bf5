/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import java.util.Objects;
import org.opensearch.flowexchange.exception.FlowExchangeException;
import org.opensearch.flowexchange.exception.RemoteProducerException;

/**
 * A failure shipped between nodes. One variant per kind of failure; consumers match them through
 * {@link Visitor}, which has to handle every variant.
 */
public interface RemoteError {

  /** Returns the human readable message. */
  String message();

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive match over the error variants. */
  interface Visitor<R> {
    R visitSqlError(SqlError error);

    R visitRetryableTxnError(RetryableTxnError error);
  }

  /** A SQL-level failure identified by its SQL state. */
  record SqlError(String code, String message) implements RemoteError {
    public SqlError {
      Objects.requireNonNull(code, "code");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSqlError(this);
    }
  }

  /** A transaction conflict the transaction layer may retry. */
  record RetryableTxnError(String txnId, String message) implements RemoteError {
    public RetryableTxnError {
      Objects.requireNonNull(txnId, "txnId");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRetryableTxnError(this);
    }
  }

  /** Converts a local failure into its wire form. */
  static RemoteError fromThrowable(Throwable t) {
    if (t instanceof RemoteProducerException) {
      return ((RemoteProducerException) t).getRemoteError();
    }
    String message = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    if (t instanceof FlowExchangeException) {
      return new SqlError(((FlowExchangeException) t).getSqlState(), message);
    }
    return new SqlError(FlowExchangeException.INTERNAL_ERROR, message);
  }
}
