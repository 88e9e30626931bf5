/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.opensearch.flowexchange.exception.CompletenessViolationException;

/**
 * Verifies the row-count records of each sender. Records of one sender must count up by one from
 * 1; the record with {@code lastMsg} set declares the total, which must equal the number of records
 * observed. A lost record is therefore detected at the record that follows it, or at the final one.
 */
public class RowCountTracker {

  private final Map<String, Integer> observed = new HashMap<>();
  private final Set<String> finished = new HashSet<>();

  /**
   * Records one row-count record.
   *
   * @throws CompletenessViolationException if the record does not continue the sender's sequence
   */
  public void observe(ProducerMetadata.RowNum record) {
    String sender = record.senderId();
    if (finished.contains(sender)) {
      throw new CompletenessViolationException(
          sender,
          "Row-count record " + record.rowNum() + " from " + sender + " after its last one");
    }
    int count = observed.merge(sender, 1, Integer::sum);
    if (record.lastMsg()) {
      finished.add(sender);
      if (record.rowNum() != count) {
        throw new CompletenessViolationException(
            sender,
            String.format(
                "Sender %s declared %d row-count records but %d were observed",
                sender, record.rowNum(), count));
      }
    } else if (record.rowNum() != count) {
      throw new CompletenessViolationException(
          sender,
          String.format(
              "Sender %s sent row-count record %d but %d were observed",
              sender, record.rowNum(), count));
    }
  }

  /** Returns true once the sender's last record has been observed and validated. */
  public boolean isComplete(String senderId) {
    return finished.contains(senderId);
  }

  /** Returns the senders seen so far whose last record has not arrived. */
  public Set<String> getIncompleteSenders() {
    Set<String> incomplete = new HashSet<>(observed.keySet());
    incomplete.removeAll(finished);
    return incomplete;
  }
}
