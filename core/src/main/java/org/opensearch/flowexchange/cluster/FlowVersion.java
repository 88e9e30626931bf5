/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.cluster;

/** Versions of the flow exchange protocol run by this build. */
public final class FlowVersion {

  /** Version of the protocol this node speaks. Bump on any incompatible framing change. */
  public static final int CURRENT = 2;

  /** Oldest version this node still exchanges streams with. */
  public static final int MIN_ACCEPTED = 2;

  private FlowVersion() {}

  /** Returns the record this node publishes while serving. */
  public static NodeCompatibilityRecord localRecord() {
    return new NodeCompatibilityRecord(CURRENT, MIN_ACCEPTED, false);
  }
}
