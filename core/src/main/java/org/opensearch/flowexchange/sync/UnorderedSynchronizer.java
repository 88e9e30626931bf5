/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.metadata.RowCountTracker;

/**
 * Emits whatever any source has ready, polling the sources round-robin so that none starves. When
 * no source has anything the caller sleeps until one of them signals readiness.
 */
class UnorderedSynchronizer extends AbstractSynchronizer {

  private final boolean[] done;
  private int remaining;
  private int nextSource;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition ready = lock.newCondition();
  private boolean dirty;

  UnorderedSynchronizer(
      List<? extends RowSource> sources, FlowContext context, RowCountTracker rowCountTracker) {
    super(sources, context, rowCountTracker);
    this.done = new boolean[sources.size()];
    this.remaining = sources.size();
    for (RowSource source : this.sources) {
      source.setReadyListener(this::signalReady);
    }
  }

  @Override
  public StreamElement next() {
    while (true) {
      if (remaining == 0) {
        return endOfInput();
      }
      // Reset before polling so that a signal arriving during the scan is not lost.
      lock.lock();
      try {
        dirty = false;
      } finally {
        lock.unlock();
      }
      StreamElement element = pollSources();
      if (element != null) {
        return element;
      }
      if (remaining > 0) {
        awaitReady();
      }
    }
  }

  private StreamElement pollSources() {
    int count = sources.size();
    for (int k = 0; k < count; k++) {
      int source = (nextSource + k) % count;
      if (done[source]) {
        continue;
      }
      StreamElement element = sources.get(source).poll();
      while (element != null) {
        switch (element.getKind()) {
          case ROW:
            nextSource = (source + 1) % count;
            return element;
          case METADATA:
            if (isTerminal(element.getMetadata())) {
              retire(source);
            }
            StreamElement emitted = onMetadata(source, element.getMetadata());
            if (emitted != null) {
              nextSource = (source + 1) % count;
              return emitted;
            }
            element = done[source] ? null : sources.get(source).poll();
            break;
          default:
            retire(source);
            element = null;
        }
      }
    }
    return null;
  }

  private void retire(int source) {
    if (!done[source]) {
      done[source] = true;
      remaining--;
    }
  }

  private void awaitReady() {
    lock.lock();
    try {
      while (!dirty) {
        ready.await();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FlowCancelledException("Interrupted while waiting for input", e);
    } finally {
      lock.unlock();
    }
  }

  private void signalReady() {
    lock.lock();
    try {
      dirty = true;
      ready.signalAll();
    } finally {
      lock.unlock();
    }
  }
}
