/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import com.google.common.base.Preconditions;
import java.util.List;
import java.util.Objects;

/**
 * Out-of-band records a producer passes to its consumer alongside rows. Exactly one of five
 * variants; every consumer matches them through {@link Visitor}, so adding a variant breaks every
 * place that has to handle it.
 *
 * <p>Metadata instances are consumed once by the receiver. They are delivered in the order sent
 * and after the rows that preceded them on the same stream.
 */
public interface ProducerMetadata {

  /** Discriminator of the variants, used for logging and as the wire tag. */
  enum Kind {
    RANGE_INFO,
    ERROR,
    TRACE_DATA,
    TXN_COORD_META,
    ROW_NUM
  }

  Kind kind();

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive match over the metadata variants. */
  interface Visitor<R> {
    R visitRangeInfos(RangeInfos metadata);

    R visitError(ProducerError metadata);

    R visitTraceData(TraceData metadata);

    R visitTxnCoordMeta(TxnCoordMeta metadata);

    R visitRowNum(RowNum metadata);
  }

  /** Advisory routing hints. Purely informational, never retried or required. */
  record RangeInfos(List<RangeInfo> rangeInfos) implements ProducerMetadata {
    public RangeInfos {
      rangeInfos = List.copyOf(rangeInfos);
    }

    @Override
    public Kind kind() {
      return Kind.RANGE_INFO;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRangeInfos(this);
    }
  }

  /** Terminal error; no further productive data follows on the stream. */
  record ProducerError(RemoteError error) implements ProducerMetadata {
    public ProducerError {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public Kind kind() {
      return Kind.ERROR;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitError(this);
    }
  }

  /** Trace spans recorded downstream, to be merged into the receiver's trace. */
  record TraceData(List<TraceSpan> spans) implements ProducerMetadata {
    public TraceData {
      spans = List.copyOf(spans);
    }

    @Override
    public Kind kind() {
      return Kind.TRACE_DATA;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTraceData(this);
    }
  }

  /** Transaction coordinator state to fold back into the coordinating transaction. */
  record TxnCoordMeta(String txnId, int epoch, long commandCount, boolean refreshInvalid)
      implements ProducerMetadata {
    public TxnCoordMeta {
      Objects.requireNonNull(txnId, "txnId");
    }

    @Override
    public Kind kind() {
      return Kind.TXN_COORD_META;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTxnCoordMeta(this);
    }
  }

  /**
   * Row-count record of one sender. {@code rowNum} is the running number of such records the sender
   * has emitted, this one included; when {@code lastMsg} is set it is the total.
   */
  record RowNum(String senderId, int rowNum, boolean lastMsg) implements ProducerMetadata {
    public RowNum {
      Objects.requireNonNull(senderId, "senderId");
      Preconditions.checkArgument(rowNum >= 0, "rowNum must be non-negative");
    }

    @Override
    public Kind kind() {
      return Kind.ROW_NUM;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRowNum(this);
    }
  }

  static ProducerMetadata error(RemoteError error) {
    return new ProducerError(error);
  }

  static ProducerMetadata error(Throwable t) {
    return new ProducerError(RemoteError.fromThrowable(t));
  }
}
