/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import java.util.Arrays;
import java.util.Objects;

/** Advisory hint about where a key range currently lives. */
public record RangeInfo(long rangeId, byte[] startKey, byte[] endKey, int leaseholderNodeId) {

  public RangeInfo {
    startKey = Objects.requireNonNull(startKey, "startKey").clone();
    endKey = Objects.requireNonNull(endKey, "endKey").clone();
  }

  @Override
  public byte[] startKey() {
    return startKey.clone();
  }

  @Override
  public byte[] endKey() {
    return endKey.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RangeInfo other
        && rangeId == other.rangeId
        && leaseholderNodeId == other.leaseholderNodeId
        && Arrays.equals(startKey, other.startKey)
        && Arrays.equals(endKey, other.endKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        rangeId, Arrays.hashCode(startKey), Arrays.hashCode(endKey), leaseholderNodeId);
  }

  @Override
  public String toString() {
    return String.format(
        "RangeInfo[%d, %s, %s @ %d]",
        rangeId, Arrays.toString(startKey), Arrays.toString(endKey), leaseholderNodeId);
  }
}
