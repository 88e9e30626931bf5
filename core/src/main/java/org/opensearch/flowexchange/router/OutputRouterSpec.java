/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import java.util.List;
import org.opensearch.flowexchange.exception.RouterConfigurationException;
import org.opensearch.flowexchange.flow.StreamEndpointSpec;

/** Describes how a stage's output rows are distributed over its destination streams. */
public class OutputRouterSpec {

  private final RouterType type;
  private final List<StreamEndpointSpec> destinations;
  private final List<Integer> hashColumns;
  private final RangeRouterSpec rangeSpec;
  private final boolean disableBuffering;

  private OutputRouterSpec(
      RouterType type,
      List<StreamEndpointSpec> destinations,
      List<Integer> hashColumns,
      RangeRouterSpec rangeSpec,
      boolean disableBuffering) {
    if (destinations.isEmpty()) {
      throw new RouterConfigurationException(type + " router needs at least one destination");
    }
    this.type = type;
    this.destinations = List.copyOf(destinations);
    this.hashColumns = List.copyOf(hashColumns);
    this.rangeSpec = rangeSpec;
    this.disableBuffering = disableBuffering;
  }

  /** Creates a PASS_THROUGH router spec with its single destination. */
  public static OutputRouterSpec passThrough(StreamEndpointSpec destination) {
    return new OutputRouterSpec(
        RouterType.PASS_THROUGH, List.of(destination), List.of(), null, false);
  }

  /** Creates a MIRROR router spec (all rows to all destinations). */
  public static OutputRouterSpec mirror(List<StreamEndpointSpec> destinations) {
    return new OutputRouterSpec(RouterType.MIRROR, destinations, List.of(), null, false);
  }

  /** Creates a BY_HASH router spec partitioning on the given column indices. */
  public static OutputRouterSpec byHash(
      List<StreamEndpointSpec> destinations, List<Integer> hashColumns) {
    if (hashColumns.isEmpty()) {
      throw new RouterConfigurationException("Hash router needs at least one hash column");
    }
    return new OutputRouterSpec(RouterType.BY_HASH, destinations, hashColumns, null, false);
  }

  /** Creates a BY_RANGE router spec. */
  public static OutputRouterSpec byRange(
      List<StreamEndpointSpec> destinations, RangeRouterSpec rangeSpec) {
    if (rangeSpec == null) {
      throw new RouterConfigurationException("Range router needs a range spec");
    }
    return new OutputRouterSpec(RouterType.BY_RANGE, destinations, List.of(), rangeSpec, false);
  }

  /**
   * Returns a copy whose destination queues are unbounded. Only for plan shapes known not to have
   * producer/consumer cycles.
   */
  public OutputRouterSpec withBufferingDisabled() {
    return new OutputRouterSpec(type, destinations, hashColumns, rangeSpec, true);
  }

  public RouterType getType() {
    return type;
  }

  public List<StreamEndpointSpec> getDestinations() {
    return destinations;
  }

  /** Returns the column indices used for hash partitioning. Empty for non-hash routers. */
  public List<Integer> getHashColumns() {
    return hashColumns;
  }

  /** Returns the range configuration, or null for non-range routers. */
  public RangeRouterSpec getRangeSpec() {
    return rangeSpec;
  }

  public boolean isBufferingDisabled() {
    return disableBuffering;
  }
}
