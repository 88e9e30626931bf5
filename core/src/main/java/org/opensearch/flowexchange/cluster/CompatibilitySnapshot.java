/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.cluster;

import java.util.Optional;

/** Read-only view of the latest compatibility records published by the cluster's nodes. */
public interface CompatibilitySnapshot {

  /** Returns the latest record of a node, or empty if the node has published none. */
  Optional<NodeCompatibilityRecord> get(int nodeId);
}
