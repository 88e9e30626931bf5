/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.exception.RoutingException;
import org.opensearch.flowexchange.exchange.OutputBuffer;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.metadata.ProducerMetadata;

/** Delivery, metadata forwarding and failure bookkeeping shared by all router types. */
abstract class AbstractRouter implements OutputRouter {

  private static final Logger log = LogManager.getLogger(AbstractRouter.class);

  protected final List<OutputBuffer> destinations;
  protected final FlowContext context;
  private final RouterStats stats;
  private RoutingException failure;
  private boolean finished;

  AbstractRouter(List<? extends OutputBuffer> destinations, FlowContext context) {
    this.destinations = List.copyOf(destinations);
    this.context = context;
    this.stats = new RouterStats(destinations.size());
  }

  @Override
  public final void route(Row row) {
    if (failure != null) {
      throw new RoutingException("Router already failed: " + failure.getMessage());
    }
    if (finished) {
      throw new IllegalStateException("Router already finished");
    }
    if (context.isCancelled()) {
      throw new FlowCancelledException(
          "Flow " + context.getFlowId() + " was cancelled: " + context.getCancelReason());
    }
    try {
      routeRow(row);
    } catch (RoutingException e) {
      failure = e;
      throw e;
    }
  }

  /** Chooses the destinations of a row and hands it to them with {@link #deliver(int, Row)}. */
  protected abstract void routeRow(Row row);

  protected void deliver(int destination, Row row) {
    if (destinations.get(destination).enqueue(row) == OutputBuffer.EnqueueResult.DELIVERED) {
      stats.recordRouted(destination);
    } else if (stats.recordDropped(destination)) {
      log.warn(
          "Destination {} of flow {} closed early, dropping its rows",
          destination,
          context.getFlowId());
    }
  }

  @Override
  public void pushMetadata(ProducerMetadata metadata) {
    if (finished) {
      throw new IllegalStateException("Router already finished");
    }
    for (OutputBuffer destination : destinations) {
      if (!destination.isConsumerClosed()
          && destination.enqueueMetadata(metadata) == OutputBuffer.EnqueueResult.DELIVERED) {
        return;
      }
    }
    log.debug(
        "No open destination for {} metadata of flow {}", metadata.kind(), context.getFlowId());
  }

  @Override
  public void finishWithError(Throwable cause) {
    if (finished) {
      log.warn(
          "Stage of flow {} failed after its router finished, error not forwarded",
          context.getFlowId(),
          cause);
      return;
    }
    log.error("Stage of flow {} failed", context.getFlowId(), cause);
    pushMetadata(ProducerMetadata.error(cause));
    finish();
  }

  @Override
  public void finish() {
    if (finished) {
      return;
    }
    finished = true;
    for (OutputBuffer destination : destinations) {
      destination.setNoMoreElements();
    }
  }

  @Override
  public RouterStats getStats() {
    return stats;
  }
}
