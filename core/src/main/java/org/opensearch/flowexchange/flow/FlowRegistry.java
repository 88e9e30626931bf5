/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.flow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.log4j.Log4j2;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.exception.SynchronizerConfigurationException;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.metadata.TraceCollector;

/**
 * Arena of the flows running on this node and of their streams, keyed by {@code (flowId,
 * streamId)}. Streams exist only inside their flow: they are created while the flow is set up and
 * removed in bulk when it is torn down.
 */
@Log4j2
public class FlowRegistry {

  private final Map<FlowId, FlowContext> flows = new ConcurrentHashMap<>();
  private final Map<FlowStreamKey, StreamBuffer> streams = new ConcurrentHashMap<>();

  /**
   * Registers a new flow.
   *
   * @throws IllegalStateException if a flow with the same id is already registered
   */
  public FlowContext registerFlow(FlowId flowId) {
    FlowContext context = new FlowContext(flowId);
    if (flows.putIfAbsent(flowId, context) != null) {
      throw new IllegalStateException("Flow " + flowId + " is already registered");
    }
    log.info("Registered flow {}", flowId);
    return context;
  }

  public Optional<FlowContext> getFlow(FlowId flowId) {
    return Optional.ofNullable(flows.get(flowId));
  }

  /** Returns the number of flows currently registered. */
  public int getFlowCount() {
    return flows.size();
  }

  /**
   * Returns the buffer of a stream, creating it on first use. Both ends of a local stream call this
   * with the same key; whichever comes first creates the buffer and the other must agree on its
   * column types.
   *
   * @throws IllegalStateException if the flow is not registered
   * @throws SynchronizerConfigurationException if the stream exists with other column types
   */
  public StreamBuffer stream(
      FlowId flowId, int streamId, List<ColumnType> columnTypes, int capacity) {
    return stream(new FlowStreamKey(flowId, streamId), columnTypes, capacity);
  }

  /** Returns the buffer the flow's results are returned through, creating it on first use. */
  public StreamBuffer syncResponseStream(
      FlowId flowId, List<ColumnType> columnTypes, int capacity) {
    return stream(FlowStreamKey.syncResponse(flowId), columnTypes, capacity);
  }

  private StreamBuffer stream(FlowStreamKey key, List<ColumnType> columnTypes, int capacity) {
    FlowContext context = flows.get(key.flowId());
    if (context == null) {
      throw new IllegalStateException("Flow " + key.flowId() + " is not registered");
    }
    StreamBuffer buffer =
        streams.computeIfAbsent(
            key,
            k -> {
              StreamBuffer created = new StreamBuffer(k.toString(), columnTypes, capacity);
              context.addCancelListener(() -> created.abort(context.getCancelReason()));
              log.debug("Created stream {}", k);
              return created;
            });
    if (!buffer.getColumnTypes().equals(columnTypes)) {
      throw new SynchronizerConfigurationException(
          String.format(
              "Stream %s carries %s but %s was expected",
              key, buffer.getColumnTypes(), columnTypes));
    }
    return buffer;
  }

  public Optional<StreamBuffer> lookupStream(FlowId flowId, int streamId) {
    return Optional.ofNullable(streams.get(new FlowStreamKey(flowId, streamId)));
  }

  public Optional<StreamBuffer> lookupSyncResponseStream(FlowId flowId) {
    return Optional.ofNullable(streams.get(FlowStreamKey.syncResponse(flowId)));
  }

  /**
   * Cancels a flow: every stream of the flow is aborted, which unblocks every producer and consumer
   * waiting on it and leaves an error explaining the cancellation for the consumer.
   *
   * @return false if the flow is unknown or was already cancelled
   */
  public boolean cancelFlow(FlowId flowId, String reason) {
    FlowContext context = flows.get(flowId);
    return context != null && context.cancel(reason);
  }

  /**
   * Tears a flow down: aborts its unfinished streams, removes it and its streams from the arena and
   * folds the trace spans its synchronizers collected.
   *
   * @return the folded trace spans, empty if the flow is unknown
   */
  public TraceCollector teardownFlow(FlowId flowId) {
    FlowContext context = flows.remove(flowId);
    if (context == null) {
      return new TraceCollector();
    }
    List<FlowStreamKey> keys = new ArrayList<>();
    for (FlowStreamKey key : streams.keySet()) {
      if (key.flowId().equals(flowId)) {
        keys.add(key);
      }
    }
    for (FlowStreamKey key : keys) {
      StreamBuffer buffer = streams.remove(key);
      if (buffer != null && !buffer.isFinished()) {
        buffer.abort("Flow " + flowId + " torn down");
      }
    }
    TraceCollector traces = context.foldTraces();
    log.info("Tore down flow {} with {} streams", flowId, keys.size());
    return traces;
  }
}
