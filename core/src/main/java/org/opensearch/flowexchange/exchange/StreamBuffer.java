/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exchange;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RemoteError;

/**
 * The in-memory channel behind one stream: a FIFO of rows and metadata between exactly one
 * producer and one consumer.
 *
 * <p>The capacity bounds the number of queued rows only. Metadata is always accepted so that a
 * producer blocked on a full queue can still be told apart from one that failed. A capacity of
 * {@link Integer#MAX_VALUE} makes the buffer unbounded.
 */
public class StreamBuffer implements OutputBuffer, RowSource {

  private static final Logger log = LogManager.getLogger(StreamBuffer.class);

  /** Capacity of an unbounded buffer. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private final String name;
  private final List<ColumnType> columnTypes;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final Condition notEmpty = lock.newCondition();
  private final ArrayDeque<StreamElement> queue = new ArrayDeque<>();

  private final int capacity;
  private int bufferedRows;
  private long droppedRows;
  private boolean noMoreElements;
  private boolean endDelivered;
  private boolean consumerClosed;
  private boolean aborted;
  private boolean producerConnected;
  private String abortReason;

  private volatile Runnable readyListener;

  /**
   * Creates a stream buffer.
   *
   * @param name name used in log messages, usually {@code flowId/streamId}
   * @param columnTypes the column types of every row carried by the stream
   * @param capacity the maximum number of queued rows, at least 1
   */
  public StreamBuffer(String name, List<ColumnType> columnTypes, int capacity) {
    Preconditions.checkArgument(capacity >= 1, "capacity must be at least 1: %s", capacity);
    this.name = name;
    this.columnTypes = List.copyOf(columnTypes);
    this.capacity = capacity;
  }

  public String getName() {
    return name;
  }

  @Override
  public List<ColumnType> getColumnTypes() {
    return columnTypes;
  }

  @Override
  public EnqueueResult enqueue(Row row) {
    checkRow(row);
    lock.lock();
    try {
      checkNotAborted();
      Preconditions.checkState(!noMoreElements, "Stream %s already finished", name);
      while (bufferedRows >= capacity && !consumerClosed && !aborted) {
        await(notFull);
      }
      checkNotAborted();
      if (consumerClosed) {
        dropRow();
        return EnqueueResult.DROPPED;
      }
      queue.addLast(StreamElement.row(row));
      bufferedRows++;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
    notifyReady();
    return EnqueueResult.DELIVERED;
  }

  @Override
  public EnqueueResult enqueueMetadata(ProducerMetadata metadata) {
    lock.lock();
    try {
      if (aborted || consumerClosed) {
        log.debug("Stream {} no longer accepts metadata, discarding {}", name, metadata.kind());
        return EnqueueResult.DROPPED;
      }
      Preconditions.checkState(!noMoreElements, "Stream %s already finished", name);
      queue.addLast(StreamElement.metadata(metadata));
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
    notifyReady();
    return EnqueueResult.DELIVERED;
  }

  @Override
  public void setNoMoreElements() {
    lock.lock();
    try {
      if (noMoreElements) {
        return;
      }
      noMoreElements = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
    notifyReady();
  }

  @Override
  public boolean isFull() {
    lock.lock();
    try {
      return bufferedRows >= capacity;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getBufferedRows() {
    lock.lock();
    try {
      return bufferedRows;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void abort(String reason) {
    lock.lock();
    try {
      if (aborted || endDelivered) {
        return;
      }
      aborted = true;
      abortReason = reason;
      Iterator<StreamElement> it = queue.iterator();
      while (it.hasNext()) {
        if (it.next().getKind() == StreamElement.Kind.ROW) {
          it.remove();
        }
      }
      bufferedRows = 0;
      if (!consumerClosed) {
        queue.addLast(
            StreamElement.metadata(
                ProducerMetadata.error(
                    new RemoteError.SqlError(FlowCancelledException.QUERY_CANCELED, reason))));
      }
      noMoreElements = true;
      notFull.signalAll();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
    log.debug("Aborted stream {}: {}", name, reason);
    notifyReady();
  }

  @Override
  public boolean isConsumerClosed() {
    lock.lock();
    try {
      return consumerClosed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isFinished() {
    lock.lock();
    try {
      return endDelivered;
    } finally {
      lock.unlock();
    }
  }

  public boolean isAborted() {
    lock.lock();
    try {
      return aborted;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the number of rows discarded because the consumer closed early. */
  public long getDroppedRows() {
    lock.lock();
    try {
      return droppedRows;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks that a producer has attached to this stream.
   *
   * @return false if a producer was already attached
   */
  public boolean markProducerConnected() {
    lock.lock();
    try {
      if (producerConnected) {
        return false;
      }
      producerConnected = true;
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isProducerConnected() {
    lock.lock();
    try {
      return producerConnected;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public StreamElement next() {
    lock.lock();
    try {
      StreamElement element;
      while ((element = take()) == null) {
        await(notEmpty);
      }
      return element;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public StreamElement poll() {
    lock.lock();
    try {
      return take();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public StreamElement poll(long timeout, TimeUnit unit) {
    long nanos = unit.toNanos(timeout);
    lock.lock();
    try {
      StreamElement element;
      while ((element = take()) == null) {
        if (nanos <= 0) {
          return null;
        }
        try {
          nanos = notEmpty.awaitNanos(nanos);
        } catch (InterruptedException e) {
          throw interrupted(e);
        }
      }
      return element;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void setReadyListener(Runnable listener) {
    this.readyListener = listener;
    boolean ready;
    lock.lock();
    try {
      ready = !queue.isEmpty() || noMoreElements;
    } finally {
      lock.unlock();
    }
    if (ready && listener != null) {
      listener.run();
    }
  }

  @Override
  public void consumerClosed() {
    lock.lock();
    try {
      if (consumerClosed) {
        return;
      }
      consumerClosed = true;
      droppedRows += bufferedRows;
      queue.clear();
      bufferedRows = 0;
      notFull.signalAll();
    } finally {
      lock.unlock();
    }
    log.debug("Consumer of stream {} closed", name);
  }

  private StreamElement take() {
    StreamElement element = queue.pollFirst();
    if (element != null) {
      if (element.getKind() == StreamElement.Kind.ROW) {
        bufferedRows--;
        notFull.signalAll();
      }
      return element;
    }
    if (noMoreElements) {
      endDelivered = true;
      return StreamElement.end();
    }
    return null;
  }

  private void dropRow() {
    if (droppedRows++ == 0) {
      log.debug("Consumer of stream {} is gone, dropping further rows", name);
    }
  }

  private void checkRow(Row row) {
    Preconditions.checkArgument(
        row.size() == columnTypes.size(),
        "Row of width %s does not match stream %s with %s columns",
        row.size(),
        name,
        columnTypes.size());
    for (int i = 0; i < columnTypes.size(); i++) {
      columnTypes.get(i).check(row.get(i));
    }
  }

  private void checkNotAborted() {
    if (aborted) {
      throw new FlowCancelledException("Stream " + name + " was aborted: " + abortReason);
    }
  }

  private void await(Condition condition) {
    try {
      condition.await();
    } catch (InterruptedException e) {
      throw interrupted(e);
    }
  }

  private FlowCancelledException interrupted(InterruptedException e) {
    Thread.currentThread().interrupt();
    return new FlowCancelledException("Interrupted while waiting on stream " + name, e);
  }

  private void notifyReady() {
    Runnable listener = readyListener;
    if (listener != null) {
      listener.run();
    }
  }
}
