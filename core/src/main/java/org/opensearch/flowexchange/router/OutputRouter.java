/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.page.Page;

/**
 * Fan-out at the end of a producing stage. Rows handed to one destination keep the order in which
 * they were routed. Not thread-safe: a router is driven by the single task running its stage.
 */
public interface OutputRouter {

  /**
   * Delivers a row to its destination streams, blocking while a chosen destination is full.
   *
   * @throws org.opensearch.flowexchange.exception.RoutingException if the row cannot be routed;
   *     the router refuses every further row afterwards
   * @throws org.opensearch.flowexchange.exception.FlowCancelledException if the flow was cancelled
   */
  void route(Row row);

  /** Routes every row of a page in order. */
  default void routePage(Page page) {
    for (Row row : page.getRows()) {
      route(row);
    }
  }

  /**
   * Forwards a metadata record to the first destination whose consumer is still reading.
   *
   * @throws IllegalStateException if the router already finished
   */
  void pushMetadata(ProducerMetadata metadata);

  /**
   * Reports a failure of the stage as terminal error metadata, then finishes the router. A failure
   * after the router finished is only logged.
   */
  void finishWithError(Throwable cause);

  /** Closes every destination stream. Idempotent. */
  void finish();

  RouterStats getStats();
}
