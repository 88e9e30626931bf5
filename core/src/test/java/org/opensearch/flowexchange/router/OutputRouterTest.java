/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.flow.FlowId;
import org.opensearch.flowexchange.flow.FlowRegistry;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RemoteError;
import org.opensearch.flowexchange.page.RowPage;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class OutputRouterTest {

  private static final List<ColumnType> TYPES = List.of(ColumnType.INT, ColumnType.STRING);

  private final FlowContext context = FlowContext.createDefault();

  @Test
  void should_pass_rows_through_in_order() {
    StreamBuffer out = buffer(0, 16);
    OutputRouter router = passThrough(out);

    router.routePage(new RowPage(List.of(Row.of(1, "a"), Row.of(2, "b")), 2));
    router.finish();

    assertEquals(List.of(Row.of(1, "a"), Row.of(2, "b")), drainRows(out));
    assertEquals(2, router.getStats().getRowsRouted(0));
  }

  @Test
  void should_mirror_rows_to_every_destination() {
    List<StreamBuffer> outs = List.of(buffer(0, 16), buffer(1, 16));
    OutputRouter router = Routers.create(mirrorSpec(2), TYPES, outs, context);

    router.route(Row.of(1, "a"));
    router.route(Row.of(2, "b"));
    router.finish();

    for (StreamBuffer out : outs) {
      assertEquals(List.of(Row.of(1, "a"), Row.of(2, "b")), drainRows(out));
    }
  }

  @Test
  void should_keep_mirroring_when_one_consumer_closed() {
    List<StreamBuffer> outs = List.of(buffer(0, 16), buffer(1, 16));
    OutputRouter router = Routers.create(mirrorSpec(2), TYPES, outs, context);
    outs.get(1).consumerClosed();

    router.route(Row.of(1, "a"));
    router.route(Row.of(2, "b"));
    router.finish();

    assertEquals(2, drainRows(outs.get(0)).size());
    assertEquals(2, router.getStats().getRowsRouted(0));
    assertEquals(2, router.getStats().getRowsDropped(1));
    assertEquals(2, router.getStats().getTotalRowsDropped());
  }

  @Test
  void should_push_metadata_to_first_open_destination() {
    List<StreamBuffer> outs = List.of(buffer(0, 16), buffer(1, 16));
    OutputRouter router = Routers.create(mirrorSpec(2), TYPES, outs, context);
    outs.get(0).consumerClosed();
    ProducerMetadata meta = new ProducerMetadata.RowNum("n1/s1", 1, false);

    router.pushMetadata(meta);

    assertEquals(meta, outs.get(1).next().getMetadata());
  }

  @Test
  void should_report_failure_and_close_destinations() {
    StreamBuffer out = buffer(0, 16);
    OutputRouter router = passThrough(out);

    router.finishWithError(new IllegalStateException("disk full"));

    assertEquals(
        ProducerMetadata.error(new RemoteError.SqlError("XX000", "disk full")),
        out.next().getMetadata());
    assertTrue(out.next().isEnd());
    assertThrows(IllegalStateException.class, () -> router.route(Row.of(1, "a")));
  }

  @Test
  void should_only_log_failure_reported_after_finish() {
    StreamBuffer out = buffer(0, 16);
    OutputRouter router = passThrough(out);
    router.route(Row.of(1, "a"));
    router.finish();

    assertDoesNotThrow(() -> router.finishWithError(new IllegalStateException("late")));

    assertEquals(Row.of(1, "a"), out.next().getRow());
    assertTrue(out.next().isEnd());
    assertThrows(
        IllegalStateException.class,
        () -> router.pushMetadata(new ProducerMetadata.RowNum("n1/s1", 1, true)));
  }

  @Test
  void should_refuse_rows_after_flow_cancelled() {
    StreamBuffer out = buffer(0, 16);
    OutputRouter router = passThrough(out);
    context.cancel("stop");

    assertThrows(FlowCancelledException.class, () -> router.route(Row.of(1, "a")));
  }

  @Test
  @Timeout(10)
  void should_unblock_route_on_full_destination_when_cancelled() throws Exception {
    FlowRegistry registry = new FlowRegistry();
    FlowId flowId = FlowId.random();
    FlowContext flow = registry.registerFlow(flowId);
    StreamBuffer out = registry.stream(flowId, 0, TYPES, 1);
    OutputRouter router =
        Routers.create(
            OutputRouterSpec.passThrough(StreamEndpointSpec.local(0)), TYPES, List.of(out), flow);
    router.route(Row.of(1, "a"));
    CompletableFuture<Void> blocked =
        CompletableFuture.runAsync(() -> router.route(Row.of(2, "b")));
    Thread.sleep(100);
    assertNull(blocked.getNow(null));

    registry.cancelFlow(flowId, "user cancel");

    Exception e = assertThrows(Exception.class, () -> blocked.get(5, TimeUnit.SECONDS));
    assertInstanceOf(FlowCancelledException.class, e.getCause());
  }

  private OutputRouter passThrough(StreamBuffer out) {
    return Routers.create(
        OutputRouterSpec.passThrough(StreamEndpointSpec.local(0)), TYPES, List.of(out), context);
  }

  private StreamBuffer buffer(int id, int capacity) {
    return new StreamBuffer("f/" + id, TYPES, capacity);
  }

  private static OutputRouterSpec mirrorSpec(int destinations) {
    List<StreamEndpointSpec> specs = new ArrayList<>();
    for (int i = 0; i < destinations; i++) {
      specs.add(StreamEndpointSpec.local(i));
    }
    return OutputRouterSpec.mirror(specs);
  }

  static List<Row> drainRows(StreamBuffer buffer) {
    List<Row> rows = new ArrayList<>();
    StreamElement element;
    while ((element = buffer.poll()) != null && !element.isEnd()) {
      if (element.getKind() == StreamElement.Kind.ROW) {
        rows.add(element.getRow());
      }
    }
    return rows;
  }
}
