/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

/** How an output router distributes the rows of a stage over its destination streams. */
public enum RouterType {
  /** Exactly one destination; every row goes there. */
  PASS_THROUGH,

  /** Every row goes to every destination. Used to broadcast a small input. */
  MIRROR,

  /** Rows are partitioned by a hash of some columns. Used for distributed joins and aggs. */
  BY_HASH,

  /** Rows are partitioned by the key range their routing columns fall into. */
  BY_RANGE
}
