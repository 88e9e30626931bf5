/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.service;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.opensearch.flowexchange.cluster.CompatibilityGate;
import org.opensearch.flowexchange.cluster.CompatibilitySnapshot;
import org.opensearch.flowexchange.cluster.FlowVersion;
import org.opensearch.flowexchange.cluster.NodeCompatibilityRecord;
import org.opensearch.flowexchange.codec.DatumCodec;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.exception.PlacementRefusedException;
import org.opensearch.flowexchange.exception.RouterConfigurationException;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.flow.FlowId;
import org.opensearch.flowexchange.flow.FlowRegistry;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RemoteError;
import org.opensearch.flowexchange.metadata.RowCountTracker;
import org.opensearch.flowexchange.metadata.TraceCollector;
import org.opensearch.flowexchange.opensearch.exchange.InboundStreamDispatcher;
import org.opensearch.flowexchange.opensearch.exchange.Outbox;
import org.opensearch.flowexchange.opensearch.framing.StreamEncoder;
import org.opensearch.flowexchange.opensearch.setting.FlowExchangeSettings;
import org.opensearch.flowexchange.opensearch.transport.FrameHandler;
import org.opensearch.flowexchange.opensearch.transport.StreamTransport;
import org.opensearch.flowexchange.router.OutputRouter;
import org.opensearch.flowexchange.router.OutputRouterSpec;
import org.opensearch.flowexchange.router.Routers;
import org.opensearch.flowexchange.sync.InputSyncSpec;
import org.opensearch.flowexchange.sync.InputSynchronizer;
import org.opensearch.flowexchange.sync.Synchronizers;

/**
 * Sets up, cancels and tears down the flows running on this node, and binds their routers and
 * synchronizers to streams.
 *
 * <ul>
 *   <li>LOCAL endpoints: producer and consumer share the registry buffer of the stream id.
 *   <li>REMOTE outputs: rows go to a registry buffer drained by an {@link Outbox} task.
 *   <li>REMOTE inputs: the registry buffer is filled by the inbound connection the dispatcher
 *       attaches; it fails if no producer connects within the connection timeout.
 *   <li>SYNC_RESPONSE outputs: rows go to the flow's sync-response buffer, read by the caller that
 *       set the flow up.
 * </ul>
 */
@Log4j2
public class FlowExchangeService implements Closeable {

  /** SQL state reported when a remote producer never connects. */
  static final String CONNECTION_FAILURE = "08006";

  private final int localNodeId;
  private final FlowExchangeSettings settings;
  private final FlowRegistry registry;
  private final StreamTransport transport;
  private final CompatibilitySnapshot compatibilitySnapshot;
  private final DatumCodec codec;
  private final InboundStreamDispatcher dispatcher;
  private final ExecutorService outboxExecutor;
  private final ScheduledThreadPoolExecutor timer;
  private final Map<FlowId, List<ScheduledFuture<?>>> connectionTimeouts =
      new ConcurrentHashMap<>();
  private volatile boolean draining;

  public FlowExchangeService(
      int localNodeId,
      FlowExchangeSettings settings,
      FlowRegistry registry,
      StreamTransport transport,
      CompatibilitySnapshot compatibilitySnapshot,
      DatumCodec codec) {
    this.localNodeId = localNodeId;
    this.settings = settings;
    this.registry = registry;
    this.transport = transport;
    this.compatibilitySnapshot = compatibilitySnapshot;
    this.codec = codec;
    this.dispatcher = new InboundStreamDispatcher(registry, codec);
    this.outboxExecutor =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder()
                .setNameFormat("flow-exchange-outbox-%d")
                .setDaemon(true)
                .build());
    this.timer =
        new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder()
                .setNameFormat("flow-exchange-timer-%d")
                .setDaemon(true)
                .build());
    timer.setRemoveOnCancelPolicy(true);
  }

  /** Returns the record this node publishes: its versions and whether it drains. */
  public NodeCompatibilityRecord localRecord() {
    return FlowVersion.localRecord().withDraining(draining);
  }

  /** Starts or stops draining. While draining, new flows are refused; running flows continue. */
  public void setDraining(boolean draining) {
    this.draining = draining;
    log.info("Node {} {} draining", localNodeId, draining ? "started" : "stopped");
  }

  /**
   * Checks that work may be placed on another node.
   *
   * @throws PlacementRefusedException if the node is unknown, incompatible or draining
   */
  public void checkPlacement(int targetNodeId) {
    CompatibilityGate.checkPlacement(localRecord(), targetNodeId, compatibilitySnapshot);
  }

  /**
   * Registers a new flow on this node.
   *
   * @throws PlacementRefusedException if this node is draining
   */
  public FlowContext setupFlow(FlowId flowId) {
    if (draining) {
      throw new PlacementRefusedException(
          localNodeId, "Node " + localNodeId + " is draining and accepts no new flows");
    }
    return registry.registerFlow(flowId);
  }

  /**
   * Builds the output router of a stage and starts the outboxes of its remote destinations.
   *
   * @param flowId the flow, already set up on this node
   * @param spec the router spec
   * @param inputTypes column types of the rows the stage produces
   */
  public OutputRouter createRouter(
      FlowId flowId, OutputRouterSpec spec, List<ColumnType> inputTypes) {
    FlowContext context = flow(flowId);
    int capacity =
        spec.isBufferingDisabled() ? StreamBuffer.UNBOUNDED : settings.getStreamBufferSize();
    List<StreamBuffer> buffers = new ArrayList<>();
    List<Outbox> outboxes = new ArrayList<>();
    for (StreamEndpointSpec destination : spec.getDestinations()) {
      switch (destination.type()) {
        case LOCAL:
          StreamBuffer local =
              registry.stream(flowId, destination.streamId(), inputTypes, capacity);
          claimProducer(local);
          buffers.add(local);
          break;
        case REMOTE:
          checkPlacement(destination.targetNodeId());
          StreamBuffer outgoing =
              registry.stream(flowId, destination.streamId(), inputTypes, capacity);
          claimProducer(outgoing);
          buffers.add(outgoing);
          outboxes.add(newOutbox(flowId, destination, outgoing, inputTypes));
          break;
        case SYNC_RESPONSE:
          StreamBuffer response = registry.syncResponseStream(flowId, inputTypes, capacity);
          claimProducer(response);
          buffers.add(response);
          break;
        default:
          throw new RouterConfigurationException("Unsupported endpoint: " + destination);
      }
    }
    OutputRouter router = Routers.create(spec, inputTypes, buffers, context);
    for (Outbox outbox : outboxes) {
      outboxExecutor.execute(outbox);
    }
    log.debug("Created {} router of flow {}", spec.getType(), flowId);
    return router;
  }

  /**
   * Builds the input synchronizer of a stage. Remote inputs become inbound slots that a producer
   * must connect to within the connection timeout.
   *
   * @param flowId the flow, already set up on this node
   * @param spec the synchronizer spec
   */
  public InputSynchronizer createSynchronizer(FlowId flowId, InputSyncSpec spec) {
    FlowContext context = flow(flowId);
    Synchronizers.validate(spec);
    int capacity = settings.getStreamBufferSize();
    List<RowSource> sources = new ArrayList<>();
    for (StreamEndpointSpec stream : spec.streams()) {
      StreamBuffer buffer =
          registry.stream(flowId, stream.streamId(), spec.columnTypes(), capacity);
      if (stream.type() == StreamEndpointSpec.Type.REMOTE) {
        connectionTimeouts
            .computeIfAbsent(flowId, id -> new CopyOnWriteArrayList<>())
            .add(scheduleConnectionTimeout(buffer));
      }
      sources.add(buffer);
    }
    RowCountTracker tracker = settings.isRowCountTracking() ? new RowCountTracker() : null;
    InputSynchronizer synchronizer = Synchronizers.create(spec, sources, context, tracker);
    log.debug("Created {} synchronizer of flow {}", spec.type(), flowId);
    return synchronizer;
  }

  /** Returns the buffer a flow's results are returned through, once its router has been built. */
  public Optional<RowSource> syncResponse(FlowId flowId) {
    return registry.lookupSyncResponseStream(flowId).map(buffer -> buffer);
  }

  /** Attaches a new inbound connection; see {@link InboundStreamDispatcher#accept(byte[])}. */
  public FrameHandler acceptInbound(byte[] firstFrame) {
    return dispatcher.accept(firstFrame);
  }

  /** Cancels a flow, unblocking every stage waiting on one of its streams. */
  public boolean cancelFlow(FlowId flowId, String reason) {
    return registry.cancelFlow(flowId, reason);
  }

  /**
   * Tears a flow down and returns the trace spans its stages collected. Pending connection
   * timeouts of the flow are cancelled.
   */
  public TraceCollector teardownFlow(FlowId flowId) {
    List<ScheduledFuture<?>> pending = connectionTimeouts.remove(flowId);
    if (pending != null) {
      pending.forEach(timeout -> timeout.cancel(false));
    }
    return registry.teardownFlow(flowId);
  }

  /** Returns the number of connection timeouts still waiting to fire. */
  int getPendingConnectionTimeouts() {
    return timer.getQueue().size();
  }

  @Override
  public void close() {
    outboxExecutor.shutdownNow();
    timer.shutdownNow();
  }

  private FlowContext flow(FlowId flowId) {
    return registry
        .getFlow(flowId)
        .orElseThrow(() -> new IllegalStateException("Flow " + flowId + " is not set up"));
  }

  private static void claimProducer(StreamBuffer buffer) {
    if (!buffer.markProducerConnected()) {
      throw new RouterConfigurationException(
          "Stream " + buffer.getName() + " already has a producer");
    }
  }

  private Outbox newOutbox(
      FlowId flowId,
      StreamEndpointSpec destination,
      StreamBuffer source,
      List<ColumnType> inputTypes) {
    StreamEncoder encoder =
        new StreamEncoder(
            flowId, destination.streamId(), DatumInfo.valueTyping(inputTypes), codec);
    Outbox.Config config =
        new Outbox.Config(
            settings.getOutboxBatchSize(),
            settings.getOutboxFlushInterval().millis(),
            settings.isRowCountTracking(),
            "n" + localNodeId + "/s" + destination.streamId());
    return new Outbox(
        flowId,
        destination.streamId(),
        destination.targetNodeId(),
        source,
        encoder,
        transport,
        config);
  }

  private ScheduledFuture<?> scheduleConnectionTimeout(StreamBuffer buffer) {
    long timeoutMillis = settings.getStreamConnectionTimeout().millis();
    return timer.schedule(
        () -> {
          // Claiming the slot makes a late producer get rejected instead of racing the error.
          if (buffer.markProducerConnected()) {
            log.warn(
                "No producer connected to stream {} within {}ms", buffer.getName(), timeoutMillis);
            buffer.enqueueMetadata(
                ProducerMetadata.error(
                    new RemoteError.SqlError(
                        CONNECTION_FAILURE,
                        "No inbound stream connection for "
                            + buffer.getName()
                            + " within "
                            + timeoutMillis
                            + "ms")));
            buffer.setNoMoreElements();
          }
        },
        timeoutMillis,
        TimeUnit.MILLISECONDS);
  }
}
