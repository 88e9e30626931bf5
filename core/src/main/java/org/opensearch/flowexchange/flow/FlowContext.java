/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.flow;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.flowexchange.metadata.TraceCollector;
import org.opensearch.flowexchange.metadata.TxnCoordinatorStates;

/**
 * Runtime state shared by the routers, synchronizers and endpoints of one flow on this node: the
 * cancellation signal, the trace collectors to fold at teardown, and the transaction coordinator
 * state received from producers.
 */
@Log4j2
public class FlowContext {

  @Getter private final FlowId flowId;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private volatile String cancelReason;
  private final List<Runnable> cancelListeners = new CopyOnWriteArrayList<>();
  private final List<TraceCollector> traceCollectors = new CopyOnWriteArrayList<>();
  @Getter private final TxnCoordinatorStates txnCoordinatorStates = new TxnCoordinatorStates();

  public FlowContext(FlowId flowId) {
    this.flowId = flowId;
  }

  /** Returns true if the flow has been cancelled. */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Returns the reason given to {@link #cancel(String)}, or null if not cancelled. */
  public String getCancelReason() {
    return cancelReason;
  }

  /**
   * Cancels the flow. Every registered listener runs once, on the calling thread; the first call
   * wins and later calls are ignored.
   *
   * @return true if this call cancelled the flow
   */
  public boolean cancel(String reason) {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    cancelReason = reason;
    log.info("Cancelling flow {}: {}", flowId, reason);
    for (Runnable listener : cancelListeners) {
      try {
        listener.run();
      } catch (RuntimeException e) {
        log.warn("Cancellation listener of flow {} failed", flowId, e);
      }
    }
    return true;
  }

  /**
   * Registers a callback run on cancellation. If the flow is already cancelled the callback runs
   * immediately. A listener racing with {@link #cancel(String)} may run twice, so listeners must
   * be idempotent.
   */
  public void addCancelListener(Runnable listener) {
    cancelListeners.add(listener);
    if (cancelled.get()) {
      listener.run();
    }
  }

  /** Registers a collector whose spans are folded into the flow's trace at teardown. */
  public void registerTraceCollector(TraceCollector collector) {
    traceCollectors.add(collector);
  }

  /**
   * Folds every registered collector into one. Called by the single owner of the flow once all
   * stages have stopped.
   */
  TraceCollector foldTraces() {
    TraceCollector folded = new TraceCollector();
    for (TraceCollector collector : traceCollectors) {
      folded.merge(collector);
    }
    return folded;
  }

  /** Creates a context with a random flow id for testing. */
  public static FlowContext createDefault() {
    return new FlowContext(FlowId.random());
  }
}
