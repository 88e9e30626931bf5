/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.List;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exchange.OutputBuffer;
import org.opensearch.flowexchange.flow.FlowContext;

/**
 * Sends every row to every destination. Rows are immutable, so all destinations share the instance.
 * A destination whose consumer is gone is skipped without waiting on it.
 */
class MirrorRouter extends AbstractRouter {

  MirrorRouter(List<? extends OutputBuffer> destinations, FlowContext context) {
    super(destinations, context);
  }

  @Override
  protected void routeRow(Row row) {
    for (int i = 0; i < destinations.size(); i++) {
      deliver(i, row);
    }
  }
}
