/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates trace spans received on a flow. Not thread-safe: each collector has a single owner
 * (a synchronizer, or the flow at teardown), and collectors are combined with {@link
 * #merge(TraceCollector)} by that owner only.
 */
public class TraceCollector {

  private final List<TraceSpan> spans = new ArrayList<>();

  public void addAll(Collection<TraceSpan> received) {
    spans.addAll(received);
  }

  /** Folds another collector's spans into this one. */
  public void merge(TraceCollector other) {
    if (other != this) {
      spans.addAll(other.spans);
    }
  }

  public List<TraceSpan> getSpans() {
    return Collections.unmodifiableList(spans);
  }

  public int size() {
    return spans.size();
  }
}
