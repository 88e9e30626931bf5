/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.codec;

import java.util.List;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.page.Page;

/**
 * Turns rows into bytes and back according to a typing descriptor. Implementations must be exact:
 * decoding the bytes produced for some rows with the same typing reproduces those rows.
 */
public interface DatumCodec {

  /**
   * Encodes the rows of a page into one buffer.
   *
   * @param page the rows; the page must have one column per typing entry
   * @param typing the encoding and type of every column
   * @return the encoded buffer
   */
  byte[] encodeRows(Page page, List<DatumInfo> typing);

  /**
   * Decodes a buffer produced by {@link #encodeRows(Page, List)}.
   *
   * @param bytes the encoded buffer
   * @param typing the typing the buffer was encoded with
   * @return the decoded rows as one page
   */
  Page decodeRows(byte[] bytes, List<DatumInfo> typing);
}
