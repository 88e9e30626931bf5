/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.cluster;

import java.util.Map;
import java.util.Optional;

/**
 * Snapshot held in memory and replaced as a whole by whatever distributes the records. Readers
 * always see one consistent generation.
 */
public class InMemoryCompatibilitySnapshot implements CompatibilitySnapshot {

  private volatile Map<Integer, NodeCompatibilityRecord> records = Map.of();

  @Override
  public Optional<NodeCompatibilityRecord> get(int nodeId) {
    return Optional.ofNullable(records.get(nodeId));
  }

  /** Replaces every record with a new generation. */
  public void replace(Map<Integer, NodeCompatibilityRecord> newRecords) {
    this.records = Map.copyOf(newRecords);
  }
}
