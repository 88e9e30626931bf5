/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.exception.SynchronizerConfigurationException;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.TraceCollector;
import org.opensearch.flowexchange.metadata.TraceSpan;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FlowRegistryTest {

  private static final List<ColumnType> TYPES = List.of(ColumnType.INT, ColumnType.STRING);

  private final FlowRegistry registry = new FlowRegistry();
  private final FlowId flowId = FlowId.random();

  @Test
  void should_share_one_buffer_between_both_ends_of_a_stream() {
    registry.registerFlow(flowId);

    StreamBuffer producerSide = registry.stream(flowId, 3, TYPES, 8);
    StreamBuffer consumerSide = registry.stream(flowId, 3, TYPES, 8);

    assertSame(producerSide, consumerSide);
    assertSame(producerSide, registry.lookupStream(flowId, 3).orElseThrow());
    assertTrue(registry.lookupStream(flowId, 4).isEmpty());
  }

  @Test
  void should_reject_duplicate_flow() {
    registry.registerFlow(flowId);

    assertThrows(IllegalStateException.class, () -> registry.registerFlow(flowId));
  }

  @Test
  void should_reject_stream_of_unregistered_flow() {
    assertThrows(IllegalStateException.class, () -> registry.stream(flowId, 1, TYPES, 8));
  }

  @Test
  void should_reject_stream_reopened_with_other_columns() {
    registry.registerFlow(flowId);
    registry.stream(flowId, 1, TYPES, 8);

    assertThrows(
        SynchronizerConfigurationException.class,
        () -> registry.stream(flowId, 1, List.of(ColumnType.INT), 8));
  }

  @Test
  void should_keep_sync_response_apart_from_numbered_streams() {
    registry.registerFlow(flowId);

    StreamBuffer response = registry.syncResponseStream(flowId, TYPES, 8);

    assertSame(response, registry.lookupSyncResponseStream(flowId).orElseThrow());
    assertTrue(registry.lookupStream(flowId, 0).isEmpty());
  }

  @Test
  void should_abort_every_stream_when_flow_is_cancelled() {
    registry.registerFlow(flowId);
    StreamBuffer first = registry.stream(flowId, 1, TYPES, 8);
    StreamBuffer second = registry.stream(flowId, 2, TYPES, 8);
    first.enqueue(Row.of(1, "a"));

    assertTrue(registry.cancelFlow(flowId, "user cancel"));
    assertFalse(registry.cancelFlow(flowId, "again"));

    assertTrue(first.isAborted());
    assertTrue(second.isAborted());
    StreamElement element = first.next();
    assertEquals(ProducerMetadata.Kind.ERROR, element.getMetadata().kind());
    assertThrows(FlowCancelledException.class, () -> second.enqueue(Row.of(2, "b")));
  }

  @Test
  void should_abort_streams_created_after_cancel() {
    registry.registerFlow(flowId);
    registry.cancelFlow(flowId, "early");

    assertTrue(registry.stream(flowId, 1, TYPES, 8).isAborted());
  }

  @Test
  void should_remove_flow_and_fold_traces_on_teardown() {
    FlowContext context = registry.registerFlow(flowId);
    StreamBuffer stream = registry.stream(flowId, 1, TYPES, 8);
    TraceCollector collector = new TraceCollector();
    collector.addAll(List.of(new TraceSpan(1L, 2L, 0L, "scan", 10L, 5L, Map.of())));
    context.registerTraceCollector(collector);

    TraceCollector traces = registry.teardownFlow(flowId);

    assertEquals(1, traces.size());
    assertTrue(stream.isAborted());
    assertTrue(registry.getFlow(flowId).isEmpty());
    assertTrue(registry.lookupStream(flowId, 1).isEmpty());
    assertEquals(0, registry.getFlowCount());
    assertEquals(0, registry.teardownFlow(flowId).size());
  }
}
