/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;
import org.opensearch.flowexchange.codec.KeyEncoder;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.RouterConfigurationException;
import org.opensearch.flowexchange.exception.RoutingException;
import org.opensearch.flowexchange.exchange.OutputBuffer;
import org.opensearch.flowexchange.flow.FlowContext;

/**
 * Partitions rows by key range. The routing columns are key-encoded and concatenated; the span
 * containing the key is found by binary search over the sorted spans.
 *
 * <p>The spans are validated when the router is built: each must be non-empty, they must be sorted
 * and must not overlap, and every destination index must exist. Overlapping spans are rejected
 * rather than resolved by a first- or last-match rule.
 */
class RangeRouter extends AbstractRouter {

  private static final Comparator<byte[]> KEY_ORDER = KeyEncoder.keyComparator();

  private final List<RangeRouterSpec.ColumnEncoding> encodings;
  private final ColumnType[] encodedTypes;
  private final byte[][] starts;
  private final byte[][] ends;
  private final int[] streams;
  private final OptionalInt defaultDest;

  RangeRouter(
      List<? extends OutputBuffer> destinations,
      RangeRouterSpec spec,
      List<ColumnType> inputTypes,
      FlowContext context) {
    super(destinations, context);
    validate(spec, inputTypes, destinations.size());
    this.encodings = spec.getEncodings();
    this.encodedTypes = new ColumnType[encodings.size()];
    for (int i = 0; i < encodings.size(); i++) {
      encodedTypes[i] = inputTypes.get(encodings.get(i).column());
    }
    List<RangeRouterSpec.Span> spans = spec.getSpans();
    this.starts = new byte[spans.size()][];
    this.ends = new byte[spans.size()][];
    this.streams = new int[spans.size()];
    for (int i = 0; i < spans.size(); i++) {
      starts[i] = spans.get(i).start();
      ends[i] = spans.get(i).end();
      streams[i] = spans.get(i).stream();
    }
    this.defaultDest = spec.getDefaultDest();
  }

  @Override
  protected void routeRow(Row row) {
    byte[] key = encodeKey(row);
    int span = findSpan(key);
    if (span >= 0) {
      deliver(streams[span], row);
    } else if (defaultDest.isPresent()) {
      deliver(defaultDest.getAsInt(), row);
    } else {
      throw new RoutingException(
          "Key " + Arrays.toString(key) + " of row " + row + " matches no span");
    }
  }

  byte[] encodeKey(Row row) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    for (int i = 0; i < encodings.size(); i++) {
      RangeRouterSpec.ColumnEncoding encoding = encodings.get(i);
      KeyEncoder.encode(out, row.get(encoding.column()), encodedTypes[i], encoding.encoding());
    }
    return out.toByteArray();
  }

  /** Returns the index of the span containing the key, or -1. */
  int findSpan(byte[] key) {
    // Last span whose start is <= key.
    int low = 0;
    int high = starts.length - 1;
    int candidate = -1;
    while (low <= high) {
      int mid = (low + high) >>> 1;
      if (KEY_ORDER.compare(starts[mid], key) <= 0) {
        candidate = mid;
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }
    if (candidate >= 0 && KEY_ORDER.compare(key, ends[candidate]) < 0) {
      return candidate;
    }
    return -1;
  }

  private static void validate(RangeRouterSpec spec, List<ColumnType> inputTypes, int streamCount) {
    if (spec.getEncodings().isEmpty()) {
      throw new RouterConfigurationException("Range router needs at least one routing column");
    }
    for (RangeRouterSpec.ColumnEncoding encoding : spec.getEncodings()) {
      if (encoding.column() < 0 || encoding.column() >= inputTypes.size()) {
        throw new RouterConfigurationException(
            "Routing column " + encoding.column() + " is out of range");
      }
      if (!encoding.encoding().isKeyEncoding()) {
        throw new RouterConfigurationException(
            "Routing column " + encoding.column() + " must use a key encoding");
      }
    }
    List<RangeRouterSpec.Span> spans = spec.getSpans();
    for (int i = 0; i < spans.size(); i++) {
      RangeRouterSpec.Span span = spans.get(i);
      if (span.stream() < 0 || span.stream() >= streamCount) {
        throw new RouterConfigurationException(
            "Span " + i + " routes to stream " + span.stream() + " of " + streamCount);
      }
      if (KEY_ORDER.compare(span.start(), span.end()) >= 0) {
        throw new RouterConfigurationException("Span " + i + " is empty: " + span);
      }
      if (i > 0) {
        RangeRouterSpec.Span previous = spans.get(i - 1);
        if (KEY_ORDER.compare(previous.start(), span.start()) >= 0) {
          throw new RouterConfigurationException(
              "Spans " + (i - 1) + " and " + i + " are not sorted");
        }
        if (KEY_ORDER.compare(previous.end(), span.start()) > 0) {
          throw new RouterConfigurationException(
              "Spans " + (i - 1) + " and " + i + " overlap: " + previous + ", " + span);
        }
      }
    }
    OptionalInt defaultDest = spec.getDefaultDest();
    if (defaultDest.isPresent() && defaultDest.getAsInt() >= streamCount) {
      throw new RouterConfigurationException(
          "Default destination " + defaultDest.getAsInt() + " of " + streamCount);
    }
  }
}
