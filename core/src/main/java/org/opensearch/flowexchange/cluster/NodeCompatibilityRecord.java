/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.cluster;

import com.google.common.base.Preconditions;

/**
 * What a node publishes about itself: the flow protocol version it runs, the oldest version it
 * still accepts, and whether it is draining.
 */
public record NodeCompatibilityRecord(int version, int minAcceptedVersion, boolean draining) {

  public NodeCompatibilityRecord {
    Preconditions.checkArgument(
        minAcceptedVersion <= version,
        "Minimum accepted version %s is newer than version %s",
        minAcceptedVersion,
        version);
  }

  /** Returns a copy with the draining flag set or cleared. */
  public NodeCompatibilityRecord withDraining(boolean draining) {
    return new NodeCompatibilityRecord(version, minAcceptedVersion, draining);
  }
}
