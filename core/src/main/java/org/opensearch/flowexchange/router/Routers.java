/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.List;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.exception.RouterConfigurationException;
import org.opensearch.flowexchange.exchange.OutputBuffer;
import org.opensearch.flowexchange.flow.FlowContext;

/** Builds output routers from their specs. */
public final class Routers {

  private Routers() {}

  /**
   * Creates the router described by a spec.
   *
   * @param spec the router spec
   * @param inputTypes column types of the rows the stage produces
   * @param destinations one output buffer per destination of the spec, in the same order
   * @param context the owning flow
   * @throws RouterConfigurationException if the spec is invalid for these inputs
   */
  public static OutputRouter create(
      OutputRouterSpec spec,
      List<ColumnType> inputTypes,
      List<? extends OutputBuffer> destinations,
      FlowContext context) {
    if (destinations.size() != spec.getDestinations().size()) {
      throw new RouterConfigurationException(
          String.format(
              "%s router has %d destinations but %d buffers were supplied",
              spec.getType(), spec.getDestinations().size(), destinations.size()));
    }
    switch (spec.getType()) {
      case PASS_THROUGH:
        return new PassThroughRouter(destinations.get(0), context);
      case MIRROR:
        return new MirrorRouter(destinations, context);
      case BY_HASH:
        for (int column : spec.getHashColumns()) {
          if (column < 0 || column >= inputTypes.size()) {
            throw new RouterConfigurationException("Hash column " + column + " is out of range");
          }
        }
        return new HashRouter(destinations, spec.getHashColumns(), inputTypes, context);
      case BY_RANGE:
        return new RangeRouter(destinations, spec.getRangeSpec(), inputTypes, context);
      default:
        throw new RouterConfigurationException("Unsupported router type: " + spec.getType());
    }
  }
}
