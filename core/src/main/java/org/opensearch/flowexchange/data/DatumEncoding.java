/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.data;

/** How a single datum is turned into bytes. */
public enum DatumEncoding {
  /** Order-preserving key encoding; unsigned byte order equals ascending value order. */
  ASCENDING_KEY,

  /** Order-preserving key encoding with the order inverted. */
  DESCENDING_KEY,

  /** Compact value encoding; carries no ordering guarantee. */
  VALUE;

  public boolean isKeyEncoding() {
    return this != VALUE;
  }
}
