/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import java.util.List;
import java.util.Objects;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Ordering;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;

/**
 * Describes the fan-in at the start of a consuming stage.
 *
 * @param type how the sources are merged
 * @param ordering merge order, empty for {@link SyncType#UNORDERED}
 * @param streams the source endpoints, in source-index order
 * @param columnTypes the schema every source conforms to
 */
public record InputSyncSpec(
    SyncType type,
    Ordering ordering,
    List<StreamEndpointSpec> streams,
    List<ColumnType> columnTypes) {

  public InputSyncSpec {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(ordering, "ordering");
    streams = List.copyOf(streams);
    columnTypes = List.copyOf(columnTypes);
  }

  public static InputSyncSpec unordered(
      List<StreamEndpointSpec> streams, List<ColumnType> columnTypes) {
    return new InputSyncSpec(SyncType.UNORDERED, Ordering.none(), streams, columnTypes);
  }

  public static InputSyncSpec ordered(
      Ordering ordering, List<StreamEndpointSpec> streams, List<ColumnType> columnTypes) {
    return new InputSyncSpec(SyncType.ORDERED, ordering, streams, columnTypes);
  }
}
