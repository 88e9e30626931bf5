/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exception;

/**
 * Work cannot be placed on a node because it is unknown, runs an incompatible version, or is
 * draining. Reported to the placement layer, which owns any retry policy.
 */
public class PlacementRefusedException extends FlowExchangeException {

  private final int nodeId;

  public PlacementRefusedException(int nodeId, String message) {
    super(message);
    this.nodeId = nodeId;
  }

  public int getNodeId() {
    return nodeId;
  }

  @Override
  public String getSqlState() {
    return "58000";
  }
}
