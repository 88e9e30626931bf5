/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.io.IOException;
import java.util.Map;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RangeInfo;
import org.opensearch.flowexchange.metadata.RemoteError;
import org.opensearch.flowexchange.metadata.TraceSpan;

/**
 * Wire form of {@link ProducerMetadata} and {@link RemoteError}: the variant tag followed by the
 * variant's fields.
 */
public final class RemoteProducerMetadata {

  private static final byte SQL_ERROR = 0;
  private static final byte RETRYABLE_TXN_ERROR = 1;

  private RemoteProducerMetadata() {}

  public static void write(StreamOutput out, ProducerMetadata metadata) throws IOException {
    out.writeEnum(metadata.kind());
    metadata.accept(WRITERS).writeTo(out);
  }

  public static ProducerMetadata read(StreamInput in) throws IOException {
    ProducerMetadata.Kind kind = in.readEnum(ProducerMetadata.Kind.class);
    switch (kind) {
      case RANGE_INFO:
        return new ProducerMetadata.RangeInfos(in.readList(RemoteProducerMetadata::readRangeInfo));
      case ERROR:
        return new ProducerMetadata.ProducerError(readError(in));
      case TRACE_DATA:
        return new ProducerMetadata.TraceData(in.readList(RemoteProducerMetadata::readSpan));
      case TXN_COORD_META:
        return new ProducerMetadata.TxnCoordMeta(
            in.readString(), in.readVInt(), in.readZLong(), in.readBoolean());
      case ROW_NUM:
        return new ProducerMetadata.RowNum(in.readString(), in.readVInt(), in.readBoolean());
      default:
        throw new IOException("Unknown producer metadata kind " + kind);
    }
  }

  private static final ProducerMetadata.Visitor<Writeable> WRITERS =
      new ProducerMetadata.Visitor<>() {
        @Override
        public Writeable visitRangeInfos(ProducerMetadata.RangeInfos metadata) {
          return out -> {
            out.writeVInt(metadata.rangeInfos().size());
            for (RangeInfo info : metadata.rangeInfos()) {
              out.writeLong(info.rangeId());
              out.writeByteArray(info.startKey());
              out.writeByteArray(info.endKey());
              out.writeVInt(info.leaseholderNodeId());
            }
          };
        }

        @Override
        public Writeable visitError(ProducerMetadata.ProducerError metadata) {
          return out -> writeError(out, metadata.error());
        }

        @Override
        public Writeable visitTraceData(ProducerMetadata.TraceData metadata) {
          return out -> {
            out.writeVInt(metadata.spans().size());
            for (TraceSpan span : metadata.spans()) {
              out.writeLong(span.traceId());
              out.writeLong(span.spanId());
              out.writeLong(span.parentSpanId());
              out.writeString(span.operation());
              out.writeZLong(span.startMicros());
              out.writeZLong(span.durationMicros());
              out.writeMap(span.tags(), StreamOutput::writeString, StreamOutput::writeString);
            }
          };
        }

        @Override
        public Writeable visitTxnCoordMeta(ProducerMetadata.TxnCoordMeta metadata) {
          return out -> {
            out.writeString(metadata.txnId());
            out.writeVInt(metadata.epoch());
            out.writeZLong(metadata.commandCount());
            out.writeBoolean(metadata.refreshInvalid());
          };
        }

        @Override
        public Writeable visitRowNum(ProducerMetadata.RowNum metadata) {
          return out -> {
            out.writeString(metadata.senderId());
            out.writeVInt(metadata.rowNum());
            out.writeBoolean(metadata.lastMsg());
          };
        }
      };

  static void writeError(StreamOutput out, RemoteError error) throws IOException {
    error
        .accept(
            new RemoteError.Visitor<Writeable>() {
              @Override
              public Writeable visitSqlError(RemoteError.SqlError sqlError) {
                return o -> {
                  o.writeByte(SQL_ERROR);
                  o.writeString(sqlError.code());
                  o.writeString(sqlError.message());
                };
              }

              @Override
              public Writeable visitRetryableTxnError(RemoteError.RetryableTxnError txnError) {
                return o -> {
                  o.writeByte(RETRYABLE_TXN_ERROR);
                  o.writeString(txnError.txnId());
                  o.writeString(txnError.message());
                };
              }
            })
        .writeTo(out);
  }

  static RemoteError readError(StreamInput in) throws IOException {
    byte tag = in.readByte();
    switch (tag) {
      case SQL_ERROR:
        return new RemoteError.SqlError(in.readString(), in.readString());
      case RETRYABLE_TXN_ERROR:
        return new RemoteError.RetryableTxnError(in.readString(), in.readString());
      default:
        throw new IOException("Unknown remote error tag " + tag);
    }
  }

  private static RangeInfo readRangeInfo(StreamInput in) throws IOException {
    return new RangeInfo(in.readLong(), in.readByteArray(), in.readByteArray(), in.readVInt());
  }

  private static TraceSpan readSpan(StreamInput in) throws IOException {
    long traceId = in.readLong();
    long spanId = in.readLong();
    long parentSpanId = in.readLong();
    String operation = in.readString();
    long startMicros = in.readZLong();
    long durationMicros = in.readZLong();
    Map<String, String> tags = in.readMap(StreamInput::readString, StreamInput::readString);
    return new TraceSpan(
        traceId, spanId, parentSpanId, operation, startMicros, durationMicros, tags);
  }
}
