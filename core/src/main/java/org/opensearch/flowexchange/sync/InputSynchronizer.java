/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.metadata.TraceCollector;

/**
 * Fan-in at the start of a consuming stage: a pull interface over several source streams. Driven
 * by the single task running the stage.
 */
public interface InputSynchronizer {

  /**
   * Returns the next row or metadata record, or the end once every source is exhausted. Blocks
   * until a source can supply what comes next.
   *
   * @throws org.opensearch.flowexchange.exception.CompletenessViolationException if row-count
   *     tracking is enabled and a sender's records do not add up
   * @throws org.opensearch.flowexchange.exception.FlowCancelledException if interrupted
   */
  StreamElement next();

  /** Tells every source that nothing more will be read. */
  void close();

  /** Returns the trace spans received from the sources so far. */
  TraceCollector getTraceCollector();
}
