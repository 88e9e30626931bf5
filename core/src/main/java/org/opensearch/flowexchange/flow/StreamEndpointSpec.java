/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.flow;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * One end of a stream as described by the plan.
 *
 * @param type where the other end lives
 * @param streamId stream id, unique within the flow; unused for {@link Type#SYNC_RESPONSE}
 * @param targetNodeId node the other end runs on; only meaningful for {@link Type#REMOTE}
 */
public record StreamEndpointSpec(Type type, int streamId, int targetNodeId) {

  /** Where the other end of the stream lives. */
  public enum Type {
    /** Both ends run on this node and share a buffer. */
    LOCAL,
    /** The other end runs on another node; rows cross the transport. */
    REMOTE,
    /** Results go back through the call that set the flow up. Router outputs only. */
    SYNC_RESPONSE
  }

  public static final int NO_NODE = -1;

  public StreamEndpointSpec {
    Objects.requireNonNull(type, "type");
    Preconditions.checkArgument(
        type != Type.REMOTE || targetNodeId != NO_NODE, "Remote endpoint needs a target node");
  }

  public static StreamEndpointSpec local(int streamId) {
    return new StreamEndpointSpec(Type.LOCAL, streamId, NO_NODE);
  }

  public static StreamEndpointSpec remote(int streamId, int targetNodeId) {
    return new StreamEndpointSpec(Type.REMOTE, streamId, targetNodeId);
  }

  public static StreamEndpointSpec syncResponse() {
    return new StreamEndpointSpec(
        Type.SYNC_RESPONSE, FlowStreamKey.SYNC_RESPONSE_STREAM_ID, NO_NODE);
  }
}
