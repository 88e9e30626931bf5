/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exchange;

import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.metadata.ProducerMetadata;

/**
 * Producer side of one stream. Buffers rows before they reach the consumer and provides
 * back-pressure: when the buffer is bounded and full, {@link #enqueue(Row)} blocks.
 */
public interface OutputBuffer {

  /** Result of handing an element to the buffer. */
  enum EnqueueResult {
    /** The element was queued for the consumer. */
    DELIVERED,
    /** The consumer is gone; the element was discarded. */
    DROPPED
  }

  /**
   * Enqueues a row, blocking while the buffer is full.
   *
   * @param row the row to send
   * @return whether the row was queued or discarded because the consumer closed
   * @throws org.opensearch.flowexchange.exception.FlowCancelledException if the stream was aborted
   *     before or while waiting
   */
  EnqueueResult enqueue(Row row);

  /**
   * Enqueues a metadata record. Metadata never waits for capacity so that errors always get
   * through.
   */
  EnqueueResult enqueueMetadata(ProducerMetadata metadata);

  /** Signals that no more elements will be enqueued. */
  void setNoMoreElements();

  /** Returns true if the buffer is full and the producer would wait (back-pressure). */
  boolean isFull();

  /** Returns the number of rows currently buffered. */
  int getBufferedRows();

  /**
   * Aborts the stream: buffered rows are discarded, an error record explaining the reason is queued
   * for the consumer, and every blocked call returns.
   */
  void abort(String reason);

  /** Returns true if the consumer has gone away. */
  boolean isConsumerClosed();

  /** Returns true once the consumer has received the end of the stream. */
  boolean isFinished();
}
