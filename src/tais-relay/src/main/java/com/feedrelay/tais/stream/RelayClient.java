package com.feedrelay.tais.stream;

/**
 * Outbound capability of one subscribed client, independent of the transport behind it.
 */
public interface RelayClient {
  /**
   * Hands serialized bytes to the client's outbound queue without blocking.
   *
   * @param payload one serialized envelope
   * @return {@code false} when the client is closed or its queue is full
   */
  boolean enqueue(byte[] payload);

  /** Whether the underlying transport is still open. */
  boolean isOpen();
}
