/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Ordering;
import org.opensearch.flowexchange.exception.SynchronizerConfigurationException;
import org.opensearch.flowexchange.exchange.StreamBuffer;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SynchronizersTest {

  private static final List<ColumnType> TYPES = List.of(ColumnType.INT, ColumnType.STRING);

  @Test
  void should_reject_synchronizer_without_streams() {
    assertThrows(
        SynchronizerConfigurationException.class,
        () -> Synchronizers.validate(InputSyncSpec.unordered(List.of(), TYPES)));
  }

  @Test
  void should_reject_sync_response_input() {
    InputSyncSpec spec = InputSyncSpec.unordered(List.of(StreamEndpointSpec.syncResponse()), TYPES);

    assertThrows(SynchronizerConfigurationException.class, () -> Synchronizers.validate(spec));
  }

  @Test
  void should_reject_ordered_synchronizer_without_ordering() {
    InputSyncSpec spec =
        InputSyncSpec.ordered(Ordering.none(), List.of(StreamEndpointSpec.local(0)), TYPES);

    assertThrows(SynchronizerConfigurationException.class, () -> Synchronizers.validate(spec));
  }

  @Test
  void should_reject_ordering_beyond_the_columns() {
    InputSyncSpec spec =
        InputSyncSpec.ordered(Ordering.asc(2), List.of(StreamEndpointSpec.local(0)), TYPES);

    assertThrows(SynchronizerConfigurationException.class, () -> Synchronizers.validate(spec));
  }

  @Test
  void should_reject_source_with_other_columns() {
    InputSyncSpec spec = InputSyncSpec.unordered(List.of(StreamEndpointSpec.local(0)), TYPES);
    StreamBuffer source = new StreamBuffer("f/0", List.of(ColumnType.INT), 4);

    assertThrows(
        SynchronizerConfigurationException.class,
        () -> Synchronizers.create(spec, List.of(source), FlowContext.createDefault()));
  }

  @Test
  void should_reject_source_count_mismatch() {
    InputSyncSpec spec =
        InputSyncSpec.unordered(
            List.of(StreamEndpointSpec.local(0), StreamEndpointSpec.local(1)), TYPES);
    StreamBuffer source = new StreamBuffer("f/0", TYPES, 4);

    assertThrows(
        SynchronizerConfigurationException.class,
        () -> Synchronizers.create(spec, List.of(source), FlowContext.createDefault()));
  }
}
