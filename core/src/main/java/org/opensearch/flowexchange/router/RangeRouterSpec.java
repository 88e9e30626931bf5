/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.opensearch.flowexchange.data.DatumEncoding;

/**
 * Configuration of a {@link RouterType#BY_RANGE} router: how to build a row's key from its routing
 * columns, and which destination each key range goes to.
 */
public final class RangeRouterSpec {

  /**
   * Key range {@code [start, end)} mapped to a destination. Keys compare as unsigned bytes.
   *
   * @param start inclusive lower bound
   * @param end exclusive upper bound
   * @param stream index into the router's destination list
   */
  public record Span(byte[] start, byte[] end, int stream) {
    public Span {
      Objects.requireNonNull(start, "start");
      Objects.requireNonNull(end, "end");
      start = start.clone();
      end = end.clone();
    }

    @Override
    public byte[] start() {
      return start.clone();
    }

    @Override
    public byte[] end() {
      return end.clone();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Span other
          && stream == other.stream
          && Arrays.equals(start, other.start)
          && Arrays.equals(end, other.end);
    }

    @Override
    public int hashCode() {
      return 31 * (31 * Arrays.hashCode(start) + Arrays.hashCode(end)) + stream;
    }

    @Override
    public String toString() {
      return "Span[" + Arrays.toString(start) + ", " + Arrays.toString(end) + ") -> " + stream;
    }
  }

  /** One routing column and the key encoding its value is appended to the key with. */
  public record ColumnEncoding(int column, DatumEncoding encoding) {
    public ColumnEncoding {
      Objects.requireNonNull(encoding, "encoding");
    }
  }

  private static final int NO_DEFAULT = -1;

  private final List<Span> spans;
  private final List<ColumnEncoding> encodings;
  private final int defaultDest;

  private RangeRouterSpec(List<Span> spans, List<ColumnEncoding> encodings, int defaultDest) {
    this.spans = List.copyOf(spans);
    this.encodings = List.copyOf(encodings);
    this.defaultDest = defaultDest;
  }

  /** Creates a spec whose unmatched keys are a routing error. */
  public static RangeRouterSpec of(List<Span> spans, List<ColumnEncoding> encodings) {
    return new RangeRouterSpec(spans, encodings, NO_DEFAULT);
  }

  /** Creates a spec whose unmatched keys go to {@code defaultDest}. */
  public static RangeRouterSpec withDefault(
      List<Span> spans, List<ColumnEncoding> encodings, int defaultDest) {
    if (defaultDest < 0) {
      throw new IllegalArgumentException("Default destination must not be negative");
    }
    return new RangeRouterSpec(spans, encodings, defaultDest);
  }

  public List<Span> getSpans() {
    return spans;
  }

  public List<ColumnEncoding> getEncodings() {
    return encodings;
  }

  public OptionalInt getDefaultDest() {
    return defaultDest == NO_DEFAULT ? OptionalInt.empty() : OptionalInt.of(defaultDest);
  }
}
