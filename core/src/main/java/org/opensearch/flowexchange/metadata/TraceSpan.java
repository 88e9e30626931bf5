/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import java.util.Map;
import java.util.Objects;

/** A finished span recorded on some node of the flow. */
public record TraceSpan(
    long traceId,
    long spanId,
    long parentSpanId,
    String operation,
    long startMicros,
    long durationMicros,
    Map<String, String> tags) {

  public TraceSpan {
    Objects.requireNonNull(operation, "operation");
    tags = Map.copyOf(tags);
  }
}
