/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.flow;

import com.google.common.base.Preconditions;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.UUID;

/** Cluster-wide identifier of a running flow. Its wire form is the 16 bytes of a UUID. */
public record FlowId(UUID uuid) {

  public static final int BYTES = 16;

  public FlowId {
    Objects.requireNonNull(uuid, "uuid");
  }

  public static FlowId random() {
    return new FlowId(UUID.randomUUID());
  }

  public static FlowId fromString(String value) {
    return new FlowId(UUID.fromString(value));
  }

  public static FlowId fromBytes(byte[] bytes) {
    Preconditions.checkArgument(
        bytes.length == BYTES, "Flow id must be %s bytes, got %s", BYTES, bytes.length);
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    return new FlowId(new UUID(buffer.getLong(), buffer.getLong()));
  }

  public byte[] toBytes() {
    return ByteBuffer.allocate(BYTES)
        .putLong(uuid.getMostSignificantBits())
        .putLong(uuid.getLeastSignificantBits())
        .array();
  }

  @Override
  public String toString() {
    return uuid.toString();
  }
}
