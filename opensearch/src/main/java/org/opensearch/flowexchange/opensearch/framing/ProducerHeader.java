/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.io.IOException;
import lombok.AllArgsConstructor;
import lombok.Data;
import org.opensearch.core.common.io.stream.StreamInput;
import org.opensearch.core.common.io.stream.StreamOutput;
import org.opensearch.core.common.io.stream.Writeable;
import org.opensearch.flowexchange.flow.FlowId;

/** First message of every stream: tells the receiving node which input slot the stream feeds. */
@Data
@AllArgsConstructor
public class ProducerHeader implements Writeable {

  private final FlowId flowId;
  private final int streamId;

  /** Constructor for deserialization from stream. */
  public ProducerHeader(StreamInput in) throws IOException {
    this.flowId = FlowId.fromBytes(in.readByteArray());
    this.streamId = in.readVInt();
  }

  @Override
  public void writeTo(StreamOutput out) throws IOException {
    out.writeByteArray(flowId.toBytes());
    out.writeVInt(streamId);
  }
}
