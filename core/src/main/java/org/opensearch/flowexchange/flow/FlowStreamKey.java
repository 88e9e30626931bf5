/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.flow;

import java.util.Objects;

/** Address of one stream in the registry arena. */
public record FlowStreamKey(FlowId flowId, int streamId) {

  /** Stream id reserved for the buffer returning a flow's results to the caller that set it up. */
  public static final int SYNC_RESPONSE_STREAM_ID = -1;

  public FlowStreamKey {
    Objects.requireNonNull(flowId, "flowId");
  }

  public static FlowStreamKey syncResponse(FlowId flowId) {
    return new FlowStreamKey(flowId, SYNC_RESPONSE_STREAM_ID);
  }

  public boolean isSyncResponse() {
    return streamId == SYNC_RESPONSE_STREAM_ID;
  }

  @Override
  public String toString() {
    return flowId + "/" + (isSyncResponse() ? "sync" : String.valueOf(streamId));
  }
}
