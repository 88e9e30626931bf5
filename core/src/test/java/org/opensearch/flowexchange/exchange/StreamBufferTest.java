/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.exchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.opensearch.flowexchange.data.ColumnType;
import org.opensearch.flowexchange.data.Row;
import org.opensearch.flowexchange.exception.FlowCancelledException;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.metadata.RemoteError;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StreamBufferTest {

  private static final List<ColumnType> TYPES = List.of(ColumnType.LONG);

  @Test
  void should_deliver_rows_and_metadata_in_order_then_end() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 10);
    ProducerMetadata meta = new ProducerMetadata.RowNum("n1/s1", 1, false);

    buffer.enqueue(Row.of(1L));
    buffer.enqueueMetadata(meta);
    buffer.enqueue(Row.of(2L));
    buffer.setNoMoreElements();

    assertEquals(Row.of(1L), buffer.next().getRow());
    assertEquals(meta, buffer.next().getMetadata());
    assertEquals(Row.of(2L), buffer.next().getRow());
    assertTrue(buffer.next().isEnd());
    assertTrue(buffer.next().isEnd());
    assertTrue(buffer.isFinished());
  }

  @Test
  @Timeout(10)
  void should_block_producer_while_full() throws Exception {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);
    buffer.enqueue(Row.of(1L));
    assertTrue(buffer.isFull());

    CompletableFuture<OutputBuffer.EnqueueResult> blocked =
        CompletableFuture.supplyAsync(() -> buffer.enqueue(Row.of(2L)));
    assertNull(waitBriefly(blocked));

    assertEquals(Row.of(1L), buffer.next().getRow());
    assertEquals(OutputBuffer.EnqueueResult.DELIVERED, blocked.get(5, TimeUnit.SECONDS));
    assertEquals(Row.of(2L), buffer.next().getRow());
  }

  @Test
  void should_accept_metadata_when_full() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);
    buffer.enqueue(Row.of(1L));

    assertEquals(
        OutputBuffer.EnqueueResult.DELIVERED,
        buffer.enqueueMetadata(ProducerMetadata.error(new RemoteError.SqlError("XX000", "x"))));
    assertEquals(1, buffer.getBufferedRows());
  }

  @Test
  @Timeout(10)
  void should_unblock_producer_and_report_error_on_abort() throws Exception {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);
    buffer.enqueue(Row.of(1L));
    CompletableFuture<OutputBuffer.EnqueueResult> blocked =
        CompletableFuture.supplyAsync(() -> buffer.enqueue(Row.of(2L)));

    buffer.abort("query cancelled");

    Exception e = assertThrows(Exception.class, () -> blocked.get(5, TimeUnit.SECONDS));
    assertInstanceOf(FlowCancelledException.class, e.getCause());
    StreamElement error = buffer.next();
    assertEquals(
        ProducerMetadata.error(
            new RemoteError.SqlError(FlowCancelledException.QUERY_CANCELED, "query cancelled")),
        error.getMetadata());
    assertTrue(buffer.next().isEnd());
    assertThrows(FlowCancelledException.class, () -> buffer.enqueue(Row.of(3L)));
    assertEquals(
        OutputBuffer.EnqueueResult.DROPPED,
        buffer.enqueueMetadata(new ProducerMetadata.RowNum("n1/s1", 1, true)));
  }

  @Test
  @Timeout(10)
  void should_unblock_consumer_on_abort() throws Exception {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 4);
    CompletableFuture<StreamElement> waiting = CompletableFuture.supplyAsync(buffer::next);
    assertNull(waitBriefly(waiting));

    buffer.abort("cancelled");

    StreamElement element = waiting.get(5, TimeUnit.SECONDS);
    assertEquals(ProducerMetadata.Kind.ERROR, element.getMetadata().kind());
  }

  @Test
  @Timeout(10)
  void should_drop_rows_once_consumer_closed() throws Exception {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);
    buffer.enqueue(Row.of(1L));
    CompletableFuture<OutputBuffer.EnqueueResult> blocked =
        CompletableFuture.supplyAsync(() -> buffer.enqueue(Row.of(2L)));

    buffer.consumerClosed();

    assertEquals(OutputBuffer.EnqueueResult.DROPPED, blocked.get(5, TimeUnit.SECONDS));
    assertEquals(OutputBuffer.EnqueueResult.DROPPED, buffer.enqueue(Row.of(3L)));
    assertTrue(buffer.isConsumerClosed());
    assertEquals(3, buffer.getDroppedRows());
  }

  @Test
  void should_reject_rows_of_wrong_shape() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);

    assertThrows(IllegalArgumentException.class, () -> buffer.enqueue(Row.of(1L, 2L)));
    assertThrows(IllegalArgumentException.class, () -> buffer.enqueue(Row.of("1")));
  }

  @Test
  void should_reject_rows_after_end() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);
    buffer.setNoMoreElements();

    assertThrows(IllegalStateException.class, () -> buffer.enqueue(Row.of(1L)));
  }

  @Test
  void should_return_null_when_poll_times_out() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 1);

    assertNull(buffer.poll());
    assertNull(buffer.poll(10, TimeUnit.MILLISECONDS));
  }

  @Test
  void should_notify_ready_listener() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 4);
    AtomicInteger signals = new AtomicInteger();
    buffer.setReadyListener(signals::incrementAndGet);
    assertEquals(0, signals.get());

    buffer.enqueue(Row.of(1L));
    buffer.setNoMoreElements();

    assertEquals(2, signals.get());
  }

  @Test
  void should_accept_only_one_producer() {
    StreamBuffer buffer = new StreamBuffer("f/1", TYPES, 4);

    assertTrue(buffer.markProducerConnected());
    assertFalse(buffer.markProducerConnected());
    assertTrue(buffer.isProducerConnected());
  }

  private static <T> T waitBriefly(CompletableFuture<T> future) throws InterruptedException {
    Thread.sleep(100);
    return future.getNow(null);
  }
}
