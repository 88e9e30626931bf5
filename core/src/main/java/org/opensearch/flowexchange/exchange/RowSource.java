/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exchange;

import java.util.List;
import java.util.concurrent.TimeUnit;
import org.opensearch.flowexchange.data.ColumnType;

/**
 * Consumer side of one stream. Elements come out in the order they were enqueued; after the {@link
 * StreamElement#end() end} element every further call returns the end again.
 */
public interface RowSource {

  /** Returns the column types of the rows this source yields. */
  List<ColumnType> getColumnTypes();

  /** Returns the next element, blocking until one is available. */
  StreamElement next();

  /** Returns the next element if one is available now, otherwise null. */
  StreamElement poll();

  /** Returns the next element, waiting at most the given time; null on timeout. */
  StreamElement poll(long timeout, TimeUnit unit);

  /**
   * Registers a callback run whenever an element becomes available or the stream ends. Used by
   * consumers that wait on several sources at once.
   */
  void setReadyListener(Runnable listener);

  /** Tells the producer that nothing more will be read; further rows are dropped. */
  void consumerClosed();
}
