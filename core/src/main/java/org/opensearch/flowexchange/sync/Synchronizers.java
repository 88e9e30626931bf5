/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

import java.util.List;
import org.opensearch.flowexchange.exception.SynchronizerConfigurationException;
import org.opensearch.flowexchange.exchange.RowSource;
import org.opensearch.flowexchange.flow.FlowContext;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;
import org.opensearch.flowexchange.metadata.RowCountTracker;

/** Builds input synchronizers from their specs. */
public final class Synchronizers {

  private Synchronizers() {}

  /** Creates a synchronizer without row-count tracking. */
  public static InputSynchronizer create(
      InputSyncSpec spec, List<? extends RowSource> sources, FlowContext context) {
    return create(spec, sources, context, null);
  }

  /**
   * Creates the synchronizer described by a spec.
   *
   * @param spec the synchronizer spec
   * @param sources one source per stream of the spec, in the same order
   * @param context the owning flow
   * @param rowCountTracker checks the senders' row-count records; null to skip the check
   * @throws SynchronizerConfigurationException if the spec is invalid or a source does not carry
   *     the spec's column types
   */
  public static InputSynchronizer create(
      InputSyncSpec spec,
      List<? extends RowSource> sources,
      FlowContext context,
      RowCountTracker rowCountTracker) {
    validate(spec);
    if (sources.size() != spec.streams().size()) {
      throw new SynchronizerConfigurationException(
          String.format(
              "Synchronizer has %d streams but %d sources were supplied",
              spec.streams().size(), sources.size()));
    }
    for (int i = 0; i < sources.size(); i++) {
      if (!sources.get(i).getColumnTypes().equals(spec.columnTypes())) {
        throw new SynchronizerConfigurationException(
            String.format(
                "Source %d carries %s but the synchronizer expects %s",
                i, sources.get(i).getColumnTypes(), spec.columnTypes()));
      }
    }
    switch (spec.type()) {
      case ORDERED:
        return new OrderedSynchronizer(sources, spec.ordering(), context, rowCountTracker);
      case UNORDERED:
        return new UnorderedSynchronizer(sources, context, rowCountTracker);
      default:
        throw new SynchronizerConfigurationException("Unsupported synchronizer: " + spec.type());
    }
  }

  /** Checks a spec on its own, before any source is bound to it. */
  public static void validate(InputSyncSpec spec) {
    if (spec.streams().isEmpty()) {
      throw new SynchronizerConfigurationException("Synchronizer needs at least one stream");
    }
    for (StreamEndpointSpec stream : spec.streams()) {
      if (stream.type() == StreamEndpointSpec.Type.SYNC_RESPONSE) {
        throw new SynchronizerConfigurationException(
            "Sync-response endpoints cannot be synchronizer inputs");
      }
    }
    if (spec.type() == SyncType.ORDERED) {
      if (spec.ordering().isEmpty()) {
        throw new SynchronizerConfigurationException("Ordered synchronizer needs an ordering");
      }
      if (spec.ordering().maxColumnIndex() >= spec.columnTypes().size()) {
        throw new SynchronizerConfigurationException(
            "Ordering " + spec.ordering() + " references a column beyond " + spec.columnTypes());
      }
    }
  }
}
