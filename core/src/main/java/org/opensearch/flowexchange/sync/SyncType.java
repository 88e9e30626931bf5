/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.sync;

/** How an input synchronizer merges its source streams. */
public enum SyncType {
  /** Any ready source; only the order within each source is kept. */
  UNORDERED,

  /** K-way merge of individually sorted sources into one sorted stream. */
  ORDERED
}
