/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.cluster;

import org.opensearch.flowexchange.exception.PlacementRefusedException;

/** Checks run before work of a flow is placed on a node. */
public final class CompatibilityGate {

  private CompatibilityGate() {}

  /** Returns true if each side runs a version the other still accepts. */
  public static boolean compatible(NodeCompatibilityRecord local, NodeCompatibilityRecord remote) {
    return remote.version() >= local.minAcceptedVersion()
        && local.version() >= remote.minAcceptedVersion();
  }

  /** Returns true if the node is draining and must not receive new work. */
  public static boolean drainable(NodeCompatibilityRecord node) {
    return node.draining();
  }

  /**
   * Checks that new work may be placed on a node. Flows already running there are not affected.
   *
   * @throws PlacementRefusedException if the node is unknown, incompatible or draining
   */
  public static void checkPlacement(
      NodeCompatibilityRecord local, int targetNodeId, CompatibilitySnapshot snapshot) {
    NodeCompatibilityRecord target =
        snapshot
            .get(targetNodeId)
            .orElseThrow(
                () ->
                    new PlacementRefusedException(
                        targetNodeId, "No compatibility record for node " + targetNodeId));
    if (!compatible(local, target)) {
      throw new PlacementRefusedException(
          targetNodeId,
          String.format(
              "Node %d runs version %d (accepts %d+), local node runs %d (accepts %d+)",
              targetNodeId,
              target.version(),
              target.minAcceptedVersion(),
              local.version(),
              local.minAcceptedVersion()));
    }
    if (drainable(target)) {
      throw new PlacementRefusedException(targetNodeId, "Node " + targetNodeId + " is draining");
    }
  }
}
