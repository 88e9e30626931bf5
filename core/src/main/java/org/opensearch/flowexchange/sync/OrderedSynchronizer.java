/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import org.opensearch.flowexchange.data.Ordering;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.metadata.RowCountTracker;

/**
 * K-way merge of sources that are each sorted by the same ordering. One head row is buffered per
 * source; every call emits the smallest head, the lowest source index winning ties, and refills
 * that source on the following call. Only the source being refilled is waited on.
 *
 * <p>Metadata read while refilling is emitted before the next row.
 */
class OrderedSynchronizer extends AbstractSynchronizer {

  private final Row[] heads;
  private final PriorityQueue<Integer> heap;
  private final ArrayDeque<StreamElement> pendingMetadata = new ArrayDeque<>();
  private int toRefill = -1;
  private boolean started;
  private boolean ended;

  OrderedSynchronizer(
      List<? extends RowSource> sources,
      Ordering ordering,
      FlowContext context,
      RowCountTracker rowCountTracker) {
    super(sources, context, rowCountTracker);
    this.heads = new Row[sources.size()];
    Comparator<Row> rowOrder = ordering.comparator();
    this.heap =
        new PriorityQueue<>(
            Math.max(1, sources.size()),
            Comparator.<Integer, Row>comparing(i -> heads[i], rowOrder)
                .thenComparing(Comparator.naturalOrder()));
  }

  @Override
  public StreamElement next() {
    if (!pendingMetadata.isEmpty()) {
      return pendingMetadata.pollFirst();
    }
    if (ended) {
      return StreamElement.end();
    }
    if (!started) {
      started = true;
      for (int i = 0; i < sources.size(); i++) {
        fill(i);
      }
    } else if (toRefill >= 0) {
      int source = toRefill;
      toRefill = -1;
      fill(source);
    }
    if (!pendingMetadata.isEmpty()) {
      return pendingMetadata.pollFirst();
    }
    Integer source = heap.poll();
    if (source == null) {
      ended = true;
      return endOfInput();
    }
    Row row = heads[source];
    heads[source] = null;
    toRefill = source;
    return StreamElement.row(row);
  }

  /** Reads from a source until it yields a head row, fails or ends. */
  private void fill(int source) {
    RowSource rowSource = sources.get(source);
    while (true) {
      StreamElement element = rowSource.next();
      switch (element.getKind()) {
        case ROW:
          heads[source] = element.getRow();
          heap.add(source);
          return;
        case METADATA:
          StreamElement emitted = onMetadata(source, element.getMetadata());
          if (emitted != null) {
            pendingMetadata.addLast(emitted);
          }
          if (isTerminal(element.getMetadata())) {
            return;
          }
          break;
        default:
          return;
      }
    }
  }
}
