/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.router;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.util.List;
import org.opensearch.flowexchange.codec.KeyEncoder;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.DatumEncoding;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exchange.OutputBuffer;
import org.opensearch.flowexchange.flow.FlowContext;

/**
 * Partitions rows by a hash of their hash columns. Each value is hashed through its ascending key
 * encoding, so equal values hash equally whatever their Java representation (byte arrays included)
 * and the concatenation of several columns is unambiguous. The seed is fixed, so routers of the
 * same flow on different nodes agree on the destination of a tuple.
 */
class HashRouter extends AbstractRouter {

  static final int SEED = 0x5f3759df;

  private final HashFunction hashFunction = Hashing.murmur3_32_fixed(SEED);
  private final int[] hashColumns;
  private final ColumnType[] hashTypes;

  HashRouter(
      List<? extends OutputBuffer> destinations,
      List<Integer> hashColumns,
      List<ColumnType> inputTypes,
      FlowContext context) {
    super(destinations, context);
    this.hashColumns = hashColumns.stream().mapToInt(Integer::intValue).toArray();
    this.hashTypes = new ColumnType[this.hashColumns.length];
    for (int i = 0; i < this.hashColumns.length; i++) {
      hashTypes[i] = inputTypes.get(this.hashColumns[i]);
    }
  }

  @Override
  protected void routeRow(Row row) {
    deliver(destinationOf(row), row);
  }

  /** Returns the destination index of a row. */
  int destinationOf(Row row) {
    Hasher hasher = hashFunction.newHasher();
    for (int i = 0; i < hashColumns.length; i++) {
      hasher.putBytes(
          KeyEncoder.encode(row.get(hashColumns[i]), hashTypes[i], DatumEncoding.ASCENDING_KEY));
    }
    return Math.floorMod(hasher.hash().asInt(), destinations.size());
  }
}
