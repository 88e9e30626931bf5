/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.flowexchange.exception.CompletenessViolationException;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RowCountTracker;
import org.opensearch.flowexchange.metadata.TraceCollector;

/**
 * Metadata handling shared by the synchronizers. Trace spans are absorbed into this synchronizer's
 * collector, transaction state is folded into the flow, row-count records are checked when a
 * tracker is set, and an error retires the source it arrived on.
 */
abstract class AbstractSynchronizer implements InputSynchronizer {

  private static final Logger log = LogManager.getLogger(AbstractSynchronizer.class);

  protected final List<RowSource> sources;
  protected final FlowContext context;
  private final TraceCollector traceCollector = new TraceCollector();
  private final RowCountTracker rowCountTracker;
  private boolean closed;

  AbstractSynchronizer(
      List<? extends RowSource> sources, FlowContext context, RowCountTracker rowCountTracker) {
    this.sources = List.copyOf(sources);
    this.context = context;
    this.rowCountTracker = rowCountTracker;
    context.registerTraceCollector(traceCollector);
  }

  /**
   * Handles a metadata record read from a source.
   *
   * @return the element to emit, or null if the record was absorbed
   */
  protected StreamElement onMetadata(int source, ProducerMetadata metadata) {
    boolean emit =
        metadata.accept(
            new ProducerMetadata.Visitor<Boolean>() {
              @Override
              public Boolean visitRangeInfos(ProducerMetadata.RangeInfos rangeInfos) {
                return true;
              }

              @Override
              public Boolean visitError(ProducerMetadata.ProducerError error) {
                log.debug(
                    "Source {} of flow {} failed: {}",
                    source,
                    context.getFlowId(),
                    error.error().message());
                sources.get(source).consumerClosed();
                return true;
              }

              @Override
              public Boolean visitTraceData(ProducerMetadata.TraceData traceData) {
                traceCollector.addAll(traceData.spans());
                return false;
              }

              @Override
              public Boolean visitTxnCoordMeta(ProducerMetadata.TxnCoordMeta txnCoordMeta) {
                context.getTxnCoordinatorStates().fold(txnCoordMeta);
                return true;
              }

              @Override
              public Boolean visitRowNum(ProducerMetadata.RowNum rowNum) {
                if (rowCountTracker != null) {
                  rowCountTracker.observe(rowNum);
                }
                return true;
              }
            });
    return emit ? StreamElement.metadata(metadata) : null;
  }

  /** Returns true if the record retires the source it arrived on. */
  protected static boolean isTerminal(ProducerMetadata metadata) {
    return metadata.kind() == ProducerMetadata.Kind.ERROR;
  }

  /** Called once every source is exhausted; verifies that every sender sent its last record. */
  protected StreamElement endOfInput() {
    if (rowCountTracker != null) {
      Set<String> incomplete = rowCountTracker.getIncompleteSenders();
      if (!incomplete.isEmpty()) {
        throw new CompletenessViolationException(
            incomplete.iterator().next(),
            "Streams ended before the last row-count record of senders " + incomplete);
      }
    }
    return StreamElement.end();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (RowSource source : sources) {
      source.consumerClosed();
    }
  }

  @Override
  public TraceCollector getTraceCollector() {
    return traceCollector;
  }
}
