/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.service;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.HashMultiset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.opensearch.common.settings.Settings;
import org.opensearch.flowexchange.cluster.CompatibilitySnapshot;
import org.opensearch.flowexchange.cluster.FlowVersion;
import org.opensearch.flowexchange.cluster.InMemoryCompatibilitySnapshot;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Ordering;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.PlacementRefusedException;
import org.opensearch.flowexchange.exception.RouterConfigurationException;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.exchange.StreamElement;
import org.opensearch.flowexchange.flow.FlowId;
import org.opensearch.flowexchange.flow.FlowRegistry;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RemoteError;
import org.opensearch.flowexchange.opensearch.codec.StreamDatumCodec;
import org.opensearch.flowexchange.opensearch.exchange.LoopbackStreamTransport;
import org.opensearch.flowexchange.opensearch.setting.FlowExchangeSettings;
import org.opensearch.flowexchange.opensearch.transport.StreamTransport;
import org.opensearch.flowexchange.router.OutputRouter;
import org.opensearch.flowexchange.router.OutputRouterSpec;
import org.opensearch.flowexchange.sync.InputSyncSpec;
import org.opensearch.flowexchange.sync.InputSynchronizer;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FlowExchangeServiceTest {

  private static final List<ColumnType> TYPES = List.of(ColumnType.LONG, ColumnType.STRING);

  @Mock private StreamTransport transport;
  @Mock private CompatibilitySnapshot snapshot;

  private final FlowRegistry registry = new FlowRegistry();
  private final List<FlowExchangeService> services = new ArrayList<>();
  private final FlowId flowId = FlowId.random();
  private FlowExchangeService service;

  @BeforeEach
  void setUp() {
    service = newService(1, registry, transport, snapshot, Settings.EMPTY);
  }

  @AfterEach
  void tearDown() {
    services.forEach(FlowExchangeService::close);
  }

  @Test
  void should_refuse_new_flows_while_draining() {
    // Given
    service.setDraining(true);

    // When / Then
    assertTrue(service.localRecord().draining());
    assertThrows(PlacementRefusedException.class, () -> service.setupFlow(flowId));
    service.setDraining(false);
    assertEquals(flowId, service.setupFlow(flowId).getFlowId());
  }

  @Test
  void should_refuse_remote_destination_on_unknown_node() {
    // Given
    when(snapshot.get(5)).thenReturn(Optional.empty());
    service.setupFlow(flowId);
    OutputRouterSpec spec = OutputRouterSpec.passThrough(StreamEndpointSpec.remote(0, 5));

    // When / Then
    assertThrows(PlacementRefusedException.class, () -> service.createRouter(flowId, spec, TYPES));
    verifyNoInteractions(transport);
  }

  @Test
  void should_wire_local_router_to_local_synchronizer() {
    // Given
    service.setupFlow(flowId);
    List<StreamEndpointSpec> streams =
        List.of(StreamEndpointSpec.local(0), StreamEndpointSpec.local(1));
    InputSynchronizer synchronizer =
        service.createSynchronizer(flowId, InputSyncSpec.unordered(streams, TYPES));
    OutputRouter router =
        service.createRouter(flowId, OutputRouterSpec.byHash(streams, List.of(0)), TYPES);

    // When
    List<Row> sent = new ArrayList<>();
    for (long i = 0; i < 50; i++) {
      Row row = Row.of(i % 7, "v" + i);
      sent.add(row);
      router.route(row);
    }
    router.finish();

    // Then
    assertEquals(HashMultiset.create(sent), HashMultiset.create(drain(synchronizer)));
  }

  @Test
  void should_refuse_second_producer_for_a_stream() {
    service.setupFlow(flowId);
    OutputRouterSpec spec = OutputRouterSpec.passThrough(StreamEndpointSpec.local(0));
    service.createRouter(flowId, spec, TYPES);

    assertThrows(
        RouterConfigurationException.class, () -> service.createRouter(flowId, spec, TYPES));
  }

  @Test
  void should_return_results_through_sync_response() {
    // Given
    service.setupFlow(flowId);
    assertFalse(service.syncResponse(flowId).isPresent());
    OutputRouter router =
        service.createRouter(
            flowId, OutputRouterSpec.passThrough(StreamEndpointSpec.syncResponse()), TYPES);

    // When
    router.route(Row.of(1L, "a"));
    router.finish();

    // Then
    RowSource response = service.syncResponse(flowId).orElseThrow();
    assertEquals(Row.of(1L, "a"), response.next().getRow());
    assertTrue(response.next().isEnd());
  }

  @Test
  @Timeout(10)
  void should_fail_remote_input_when_no_producer_connects() {
    // Given
    Settings settings =
        Settings.builder()
            .put(FlowExchangeSettings.STREAM_CONNECTION_TIMEOUT.getKey(), "50ms")
            .build();
    FlowExchangeService impatient =
        newService(2, new FlowRegistry(), transport, snapshot, settings);
    impatient.setupFlow(flowId);

    // When
    InputSynchronizer synchronizer =
        impatient.createSynchronizer(
            flowId,
            InputSyncSpec.unordered(List.of(StreamEndpointSpec.remote(3, 1)), TYPES));

    // Then
    ProducerMetadata.ProducerError error =
        (ProducerMetadata.ProducerError) synchronizer.next().getMetadata();
    assertEquals(
        FlowExchangeService.CONNECTION_FAILURE, ((RemoteError.SqlError) error.error()).code());
    assertTrue(synchronizer.next().isEnd());
  }

  @Test
  @Timeout(30)
  void should_stream_rows_between_nodes() {
    // Given
    LoopbackStreamTransport loopback = new LoopbackStreamTransport();
    InMemoryCompatibilitySnapshot cluster = new InMemoryCompatibilitySnapshot();
    cluster.replace(Map.of(1, FlowVersion.localRecord(), 2, FlowVersion.localRecord()));
    FlowExchangeService producer =
        newService(1, new FlowRegistry(), loopback, cluster, Settings.EMPTY);
    FlowExchangeService consumer =
        newService(2, new FlowRegistry(), loopback, cluster, Settings.EMPTY);
    loopback.register(2, consumer::acceptInbound);

    consumer.setupFlow(flowId);
    InputSynchronizer synchronizer =
        consumer.createSynchronizer(
            flowId,
            InputSyncSpec.ordered(
                Ordering.asc(0), List.of(StreamEndpointSpec.remote(1, 1)), TYPES));
    producer.setupFlow(flowId);
    OutputRouter router =
        producer.createRouter(
            flowId, OutputRouterSpec.passThrough(StreamEndpointSpec.remote(1, 2)), TYPES);

    // When
    for (long i = 0; i < 500; i++) {
      router.route(Row.of(i, "row"));
    }
    router.finish();

    // Then
    List<Row> received = drain(synchronizer);
    assertThat(received, hasSize(500));
    assertEquals(Row.of(499L, "row"), received.get(499));
    assertThat(loopback.getFramesSent(), greaterThan(1));
  }

  @Test
  void should_cancel_connection_timeouts_on_teardown() {
    // Given
    service.setupFlow(flowId);
    service.createSynchronizer(
        flowId, InputSyncSpec.unordered(List.of(StreamEndpointSpec.remote(3, 2)), TYPES));
    assertEquals(1, service.getPendingConnectionTimeouts());

    // When
    service.teardownFlow(flowId);

    // Then
    assertEquals(0, service.getPendingConnectionTimeouts());
  }

  @Test
  void should_forget_flow_on_teardown() {
    service.setupFlow(flowId);
    service.createRouter(flowId, OutputRouterSpec.passThrough(StreamEndpointSpec.local(0)), TYPES);

    assertTrue(service.cancelFlow(flowId, "user cancel"));
    assertEquals(0, service.teardownFlow(flowId).size());
    assertEquals(0, registry.getFlowCount());
    assertFalse(service.cancelFlow(flowId, "again"));
  }

  private FlowExchangeService newService(
      int nodeId,
      FlowRegistry nodeRegistry,
      StreamTransport nodeTransport,
      CompatibilitySnapshot compatibility,
      Settings settings) {
    FlowExchangeService created =
        new FlowExchangeService(
            nodeId,
            new FlowExchangeSettings(settings),
            nodeRegistry,
            nodeTransport,
            compatibility,
            new StreamDatumCodec());
    services.add(created);
    return created;
  }

  private static List<Row> drain(InputSynchronizer synchronizer) {
    List<Row> rows = new ArrayList<>();
    for (StreamElement e = synchronizer.next(); !e.isEnd(); e = synchronizer.next()) {
      if (e.getKind() == StreamElement.Kind.ROW) {
        rows.add(e.getRow());
      }
    }
    return rows;
  }
}
