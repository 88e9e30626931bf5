/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.util.List;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.page.Page;

/**
 * A validated message: its rows, then its metadata.
 *
 * @param header the header if this was the stream's first message, otherwise null
 * @param page the rows of the message, empty if it carried none
 */
public record DecodedMessage(ProducerHeader header, Page page, List<ProducerMetadata> metadata) {

  public DecodedMessage {
    metadata = List.copyOf(metadata);
  }
}
