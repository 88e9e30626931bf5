/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Latest transaction coordinator state received per transaction; last writer wins. */
public class TxnCoordinatorStates {

  private final Map<String, ProducerMetadata.TxnCoordMeta> latest = new ConcurrentHashMap<>();

  public void fold(ProducerMetadata.TxnCoordMeta meta) {
    latest.put(meta.txnId(), meta);
  }

  public Optional<ProducerMetadata.TxnCoordMeta> get(String txnId) {
    return Optional.ofNullable(latest.get(txnId));
  }
}
