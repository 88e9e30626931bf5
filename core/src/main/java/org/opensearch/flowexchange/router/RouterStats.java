/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.concurrent.atomic.AtomicLongArray;

/** Per-destination row counters of a router, readable from any thread. */
public class RouterStats {

  private final AtomicLongArray routed;
  private final AtomicLongArray dropped;

  public RouterStats(int destinations) {
    this.routed = new AtomicLongArray(destinations);
    this.dropped = new AtomicLongArray(destinations);
  }

  void recordRouted(int destination) {
    routed.incrementAndGet(destination);
  }

  /** Records a dropped row and returns true if it was the first one for that destination. */
  boolean recordDropped(int destination) {
    return dropped.incrementAndGet(destination) == 1;
  }

  /** Returns the rows delivered to a destination. */
  public long getRowsRouted(int destination) {
    return routed.get(destination);
  }

  /** Returns the rows discarded because the destination's consumer had closed. */
  public long getRowsDropped(int destination) {
    return dropped.get(destination);
  }

  public long getTotalRowsDropped() {
    long total = 0;
    for (int i = 0; i < dropped.length(); i++) {
      total += dropped.get(i);
    }
    return total;
  }
}
