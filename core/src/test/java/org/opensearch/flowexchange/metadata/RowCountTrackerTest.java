/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.metadata;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.flowexchange.exception.CompletenessViolationException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RowCountTrackerTest {

  private final RowCountTracker tracker = new RowCountTracker();

  @Test
  void should_accept_consecutive_records_per_sender() {
    tracker.observe(new ProducerMetadata.RowNum("n1/s1", 1, false));
    tracker.observe(new ProducerMetadata.RowNum("n2/s1", 1, false));
    tracker.observe(new ProducerMetadata.RowNum("n1/s1", 2, false));
    tracker.observe(new ProducerMetadata.RowNum("n1/s1", 3, true));

    assertTrue(tracker.isComplete("n1/s1"));
    assertFalse(tracker.isComplete("n2/s1"));
    assertThat(tracker.getIncompleteSenders(), contains("n2/s1"));
  }

  @Test
  void should_detect_missing_intermediate_record() {
    tracker.observe(new ProducerMetadata.RowNum("n1/s1", 1, false));

    CompletenessViolationException e =
        assertThrows(
            CompletenessViolationException.class,
            () -> tracker.observe(new ProducerMetadata.RowNum("n1/s1", 3, false)));
    assertEquals("n1/s1", e.getSenderId());
  }

  @Test
  void should_detect_last_record_with_wrong_total() {
    tracker.observe(new ProducerMetadata.RowNum("n1/s1", 1, false));

    assertThrows(
        CompletenessViolationException.class,
        () -> tracker.observe(new ProducerMetadata.RowNum("n1/s1", 3, true)));
  }

  @Test
  void should_reject_records_after_last() {
    tracker.observe(new ProducerMetadata.RowNum("n1/s1", 1, true));

    assertThrows(
        CompletenessViolationException.class,
        () -> tracker.observe(new ProducerMetadata.RowNum("n1/s1", 2, false)));
  }
}
