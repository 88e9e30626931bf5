/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exchange;

import java.util.Objects;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.metadata.ProducerMetadata;

/**
 * One item pulled from a stream: a row, a metadata record, or the end of the stream. Callers switch
 * on {@link #getKind()}; the accessor of any other kind throws.
 */
public final class StreamElement {

  /** What the element carries. */
  public enum Kind {
    ROW,
    METADATA,
    END
  }

  private static final StreamElement END = new StreamElement(Kind.END, null, null);

  private final Kind kind;
  private final Row row;
  private final ProducerMetadata metadata;

  private StreamElement(Kind kind, Row row, ProducerMetadata metadata) {
    this.kind = kind;
    this.row = row;
    this.metadata = metadata;
  }

  public static StreamElement row(Row row) {
    return new StreamElement(Kind.ROW, Objects.requireNonNull(row, "row"), null);
  }

  public static StreamElement metadata(ProducerMetadata metadata) {
    return new StreamElement(Kind.METADATA, null, Objects.requireNonNull(metadata, "metadata"));
  }

  public static StreamElement end() {
    return END;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isEnd() {
    return kind == Kind.END;
  }

  public Row getRow() {
    if (kind != Kind.ROW) {
      throw new IllegalStateException("Not a row element: " + kind);
    }
    return row;
  }

  public ProducerMetadata getMetadata() {
    if (kind != Kind.METADATA) {
      throw new IllegalStateException("Not a metadata element: " + kind);
    }
    return metadata;
  }

  @Override
  public String toString() {
    switch (kind) {
      case ROW:
        return "Row" + row;
      case METADATA:
        return "Metadata{" + metadata.kind() + '}';
      default:
        return "End";
    }
  }
}
