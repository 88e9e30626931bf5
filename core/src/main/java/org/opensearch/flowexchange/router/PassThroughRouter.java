/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.List;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exchange.OutputBuffer;
import org.opensearch.flowexchange.flow.FlowContext;

/** Sends every row to the single destination. */
class PassThroughRouter extends AbstractRouter {

  PassThroughRouter(OutputBuffer destination, FlowContext context) {
    super(List.of(destination), context);
  }

  @Override
  protected void routeRow(Row row) {
    deliver(0, row);
  }
}
