/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.flowexchange.opensearch.framing;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.opensearch.flowexchange.codec.DatumCodec;
import org.opensearch.flowexchange.data.DatumInfo;
import org.opensearch.flowexchange.exception.ProtocolViolationException;
import org.opensearch.flowexchange.metadata.ProducerMetadata;
import org.opensearch.flowexchange.page.Page;
import org.opensearch.flowexchange.page.RowPage;

/**
 * Consumer side of the stream protocol. Validates every message of one stream against what came
 * before and decodes its rows. Any violation is fatal to the stream:
 *
 * <ul>
 *   <li>the first message has no header, or a later one has one
 *   <li>typing arrives a second time, changed or not
 *   <li>encoded rows arrive before typing
 *   <li>a message carries both encoded rows and a zero-column row count, or a count on a stream
 *       whose typing has columns
 *   <li>the encoded rows do not decode with the typing
 *   <li>rows, or a second error, arrive after an error
 * </ul>
 */
public class StreamDecoder {

  private final DatumCodec codec;
  private ProducerHeader header;
  private List<DatumInfo> typing;
  private boolean failed;

  public StreamDecoder(DatumCodec codec) {
    this.codec = codec;
  }

  /**
   * Parses one frame without validating it against the stream.
   *
   * @throws ProtocolViolationException if the frame is malformed
   */
  public static ProducerMessage parse(byte[] frame) {
    try {
      return ProducerMessage.fromBytes(frame);
    } catch (IOException | RuntimeException e) {
      throw new ProtocolViolationException("Malformed producer message: " + e.getMessage(), e);
    }
  }

  /** Parses and validates one frame. */
  public DecodedMessage decode(byte[] frame) {
    return decode(parse(frame));
  }

  /** Validates one message and decodes its rows. */
  public DecodedMessage decode(ProducerMessage message) {
    if (message.getHeader() != null) {
      if (header != null) {
        throw new ProtocolViolationException("Duplicate header on stream " + describe());
      }
      header = message.getHeader();
    } else if (header == null) {
      throw new ProtocolViolationException("First message of the stream has no header");
    }
    if (message.getTyping() != null) {
      if (typing != null) {
        throw new ProtocolViolationException(
            "Typing sent twice on stream " + describe() + ": " + message.getTyping());
      }
      typing = message.getTyping();
    }
    Page page = decodeRows(message.getData());
    for (ProducerMetadata metadata : message.getData().getMetadata()) {
      if (metadata.kind() == ProducerMetadata.Kind.ERROR) {
        if (failed) {
          throw new ProtocolViolationException("Second terminal error on stream " + describe());
        }
        failed = true;
      }
    }
    return new DecodedMessage(message.getHeader(), page, message.getData().getMetadata());
  }

  private Page decodeRows(ProducerData data) {
    if (!data.hasEncodedRows() && data.getNumEmptyRows() == 0) {
      return Page.empty(typing == null ? 0 : typing.size());
    }
    if (failed) {
      throw new ProtocolViolationException("Rows after terminal error on stream " + describe());
    }
    if (data.hasEncodedRows()) {
      if (data.getNumEmptyRows() > 0) {
        throw new ProtocolViolationException(
            "Message on stream " + describe() + " has both encoded and zero-column rows");
      }
      if (typing == null) {
        throw new ProtocolViolationException("Rows before typing on stream " + describe());
      }
      try {
        return codec.decodeRows(data.getRawBytes(), typing);
      } catch (IllegalArgumentException | UncheckedIOException | ArithmeticException e) {
        throw new ProtocolViolationException(
            "Rows on stream " + describe() + " do not match typing " + typing, e);
      }
    }
    if (typing != null && !typing.isEmpty()) {
      throw new ProtocolViolationException(
          "Zero-column rows on stream " + describe() + " with typing " + typing);
    }
    return RowPage.ofEmptyRows(data.getNumEmptyRows());
  }

  /** Returns the header of the stream, or null before the first message. */
  public ProducerHeader getHeader() {
    return header;
  }

  /** Returns the stream's typing, or null until it has been established. */
  public List<DatumInfo> getTyping() {
    return typing;
  }

  private String describe() {
    return header == null ? "<unknown>" : header.getFlowId() + "/" + header.getStreamId();
  }
}
